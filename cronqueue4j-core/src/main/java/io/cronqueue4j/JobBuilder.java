package io.cronqueue4j;

import io.cronqueue4j.core.JobSpec;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + insert into the job store</li>
 * </ul>
 */
public interface JobBuilder<J> {

    /**
     * Options for repeat scheduling.
     * <ul>
     *   <li>skipImmediate: if true, do not run immediately; schedule from the next cron occurrence</li>
     * </ul>
     */
    record RepeatOptions(boolean skipImmediate) {
        public static RepeatOptions defaults() {
            return new RepeatOptions(true);
        }
    }

    /**
     * Schedule the job to become due at the specified absolute time.
     */
    JobBuilder<J> schedule(Instant time);

    /**
     * Repeat on a cron expression (5 or 6 fields, or native Quartz syntax).
     */
    JobBuilder<J> repeatEvery(String cron);

    JobBuilder<J> repeatEvery(String cron, RepeatOptions options);

    /**
     * Stop recurring once the next occurrence would be at or after {@code until}.
     */
    JobBuilder<J> repeatUntil(Instant until);

    /**
     * Delete the row instead of keeping it inert once it expires.
     */
    JobBuilder<J> autoRemove(boolean autoRemove);

    /**
     * Build an immutable job spec (not persisted).
     */
    JobSpec build();

    /**
     * Build + persist (insert).
     */
    J save();
}
