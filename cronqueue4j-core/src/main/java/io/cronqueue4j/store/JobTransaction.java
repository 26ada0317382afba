package io.cronqueue4j.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Handle passed to {@link JobStore#transaction}; every call takes part in the same transaction.
 */
public interface JobTransaction<J> {

    /**
     * Find one job whose due time is set and not after {@code now}.
     * Returns a snapshot that later updates in this transaction do not alter.
     */
    Optional<J> findOneDue(Instant now);

    long updateDueAt(String id, Instant dueAt);

    long deleteById(String id);
}
