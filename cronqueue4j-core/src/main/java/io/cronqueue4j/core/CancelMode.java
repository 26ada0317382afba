package io.cronqueue4j.core;

public enum CancelMode {
    /**
     * Keep the row but clear its due time so it is never claimed again.
     */
    DISABLE,
    /**
     * Hard delete the row.
     */
    DELETE
}
