package io.cronqueue4j.core;

import java.time.Instant;

/**
 * Typed access to the scheduling fields of a job entity.
 *
 * <p>The scheduler never inspects entities reflectively. Callers supply an accessor for their own
 * entity type, or use the accessor shipped with {@link CronJob} (or the Mongo document).
 *
 * @param <J> job entity type
 */
public interface JobAccessor<J> {

    J newInstance();

    String getId(J job);

    void setId(J job, String id);

    /**
     * Time at which the job becomes eligible for claiming. Null means inert.
     */
    Instant getDueAt(J job);

    void setDueAt(J job, Instant dueAt);

    /**
     * Cron expression for recurring jobs, or null for one-shot jobs.
     */
    String getInterval(J job);

    void setInterval(J job, String interval);

    /**
     * Exclusive upper bound for recurrences, or null for unbounded.
     */
    Instant getRepeatUntil(J job);

    void setRepeatUntil(J job, Instant repeatUntil);

    boolean isAutoRemove(J job);

    void setAutoRemove(J job, boolean autoRemove);

    default boolean isRecurring(J job) {
        String interval = getInterval(job);
        return interval != null && !interval.isBlank();
    }

    /**
     * Field-by-field copy of the scheduling fields (and id) into a fresh instance.
     * Entities carrying more state than that should override this.
     */
    default J copy(J source) {
        J target = newInstance();
        setId(target, getId(source));
        setDueAt(target, getDueAt(source));
        setInterval(target, getInterval(source));
        setRepeatUntil(target, getRepeatUntil(source));
        setAutoRemove(target, isAutoRemove(source));
        return target;
    }
}
