package io.cronqueue4j.store;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Persistence contract consumed by the scheduler.
 *
 * <p>Claim exclusivity across scheduler instances depends entirely on {@link #transaction(Function)}:
 * a find-then-update executed inside it must be indivisible with respect to concurrent transactions
 * issuing the same query.
 *
 * @param <J> job entity type
 */
public interface JobStore<J> {

    /**
     * Run {@code work} atomically. Changes are committed when it returns and rolled back when it throws.
     */
    <R> R transaction(Function<JobTransaction<J>, R> work);

    /**
     * Set (or clear, when {@code dueAt} is null) the due time of a job outside any transaction.
     *
     * @return modified count (0 or 1)
     */
    long updateDueAt(String id, Instant dueAt);

    /**
     * Hard delete job by id outside any transaction.
     *
     * @return deleted count (0 or 1)
     */
    long deleteById(String id);

    /**
     * Persist a new job. Assigns an id when the entity has none.
     *
     * @return the stored job
     */
    J insert(J job);

    Optional<J> findById(String id);
}
