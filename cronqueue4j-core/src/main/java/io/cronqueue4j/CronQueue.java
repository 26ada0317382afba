package io.cronqueue4j;

import io.cronqueue4j.core.CancelMode;
import io.cronqueue4j.core.CancelResult;

import java.time.Instant;

/**
 * Main scheduler API.
 *
 * <p>Turns a store of job rows into a queue. Supports two scheduling styles:
 * <ul>
 *   <li>One-shot delayed jobs (single run at a specific {@link Instant})</li>
 *   <li>Recurring jobs driven by a cron expression, optionally bounded by a repeat-until time</li>
 * </ul>
 *
 * <p>Several queues may poll the same store; a due job is claimed by exactly one of them.
 *
 * @param <J> job entity type
 */
public interface CronQueue<J> {

    /**
     * Start polling. No-op when already running.
     */
    void start();

    /**
     * Stop polling and wait for the in-flight job (if any) to finish. Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * True while a claim, callback or reschedule is in progress.
     */
    boolean isProcessing();

    /**
     * True when the most recent claim attempt found no due job.
     */
    boolean isIdle();

    JobBuilder<J> create();

    /**
     * Schedule a one-time job at an absolute time.
     */
    JobBuilder<J> schedule(Instant time);

    /**
     * Create and persist a job that is due immediately.
     * Callers do not need to call {@code save()}.
     */
    J now();

    /**
     * Create and persist a recurring job for the given cron expression.
     */
    J every(String cron, JobBuilder.RepeatOptions options);

    CancelResult cancel(String id, CancelMode mode);
}
