package io.cronqueue4j.core;

/**
 * Raised when the scheduler itself cannot change state (e.g. the start hook failed).
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
