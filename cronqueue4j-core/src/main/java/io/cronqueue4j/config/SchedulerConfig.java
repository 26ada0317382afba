package io.cronqueue4j.config;

import io.cronqueue4j.ErrorHandler;
import io.cronqueue4j.JobHandler;
import io.cronqueue4j.LifecycleHook;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration for a scheduler instance: timings plus the hooks it drives.
 *
 * <p>{@code lockDuration} must exceed the worst-case duration of {@code onNewJob}; otherwise another
 * instance can re-claim a job that is still being processed.
 */
public final class SchedulerConfig<J> {

    public static final Duration DEFAULT_NEXT_DELAY = Duration.ZERO;
    public static final Duration DEFAULT_IDLE_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_LOCK_DURATION = Duration.ofMinutes(10);
    public static final Duration DEFAULT_REPROCESS_DELAY = Duration.ZERO;

    private final Duration nextDelay;
    private final Duration idleDelay;
    private final Duration lockDuration;
    private final Duration reprocessDelay;
    private final JobHandler<J> onNewJob;
    private final LifecycleHook onStart;
    private final LifecycleHook onStop;
    private final LifecycleHook onIdle;
    private final ErrorHandler onError;
    private final Clock clock;

    private SchedulerConfig(Builder<J> b) {
        this.nextDelay = nonNegative(b.nextDelay, "nextDelay");
        this.idleDelay = nonNegative(b.idleDelay, "idleDelay");
        this.lockDuration = nonNegative(b.lockDuration, "lockDuration");
        this.reprocessDelay = nonNegative(b.reprocessDelay, "reprocessDelay");
        this.onNewJob = Objects.requireNonNull(b.onNewJob, "onNewJob must not be null");
        this.onStart = Objects.requireNonNull(b.onStart, "onStart must not be null");
        this.onStop = Objects.requireNonNull(b.onStop, "onStop must not be null");
        this.onIdle = Objects.requireNonNull(b.onIdle, "onIdle must not be null");
        this.onError = Objects.requireNonNull(b.onError, "onError must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
    }

    public static <J> Builder<J> builder() {
        return new Builder<>();
    }

    public static <J> SchedulerConfig<J> defaults() {
        return new Builder<J>().build();
    }

    /**
     * Wait before each tick.
     */
    public Duration getNextDelay() {
        return nextDelay;
    }

    /**
     * Extra wait after a tick that found no due job (or failed).
     */
    public Duration getIdleDelay() {
        return idleDelay;
    }

    public Duration getLockDuration() {
        return lockDuration;
    }

    /**
     * Minimum distance between two runs of the same recurring job, added to its previous due time.
     */
    public Duration getReprocessDelay() {
        return reprocessDelay;
    }

    public JobHandler<J> getOnNewJob() {
        return onNewJob;
    }

    public LifecycleHook getOnStart() {
        return onStart;
    }

    public LifecycleHook getOnStop() {
        return onStop;
    }

    public LifecycleHook getOnIdle() {
        return onIdle;
    }

    public ErrorHandler getOnError() {
        return onError;
    }

    public Clock getClock() {
        return clock;
    }

    private static Duration nonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return d;
    }

    public static final class Builder<J> {
        private Duration nextDelay = DEFAULT_NEXT_DELAY;
        private Duration idleDelay = DEFAULT_IDLE_DELAY;
        private Duration lockDuration = DEFAULT_LOCK_DURATION;
        private Duration reprocessDelay = DEFAULT_REPROCESS_DELAY;
        private JobHandler<J> onNewJob = JobHandler.noop();
        private LifecycleHook onStart = LifecycleHook.NOOP;
        private LifecycleHook onStop = LifecycleHook.NOOP;
        private LifecycleHook onIdle = LifecycleHook.NOOP;
        private ErrorHandler onError = ErrorHandler.LOGGING;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder<J> nextDelay(Duration nextDelay) {
            this.nextDelay = nextDelay;
            return this;
        }

        public Builder<J> idleDelay(Duration idleDelay) {
            this.idleDelay = idleDelay;
            return this;
        }

        public Builder<J> lockDuration(Duration lockDuration) {
            this.lockDuration = lockDuration;
            return this;
        }

        public Builder<J> reprocessDelay(Duration reprocessDelay) {
            this.reprocessDelay = reprocessDelay;
            return this;
        }

        public Builder<J> onNewJob(JobHandler<J> onNewJob) {
            this.onNewJob = onNewJob;
            return this;
        }

        public Builder<J> onStart(LifecycleHook onStart) {
            this.onStart = onStart;
            return this;
        }

        public Builder<J> onStop(LifecycleHook onStop) {
            this.onStop = onStop;
            return this;
        }

        public Builder<J> onIdle(LifecycleHook onIdle) {
            this.onIdle = onIdle;
            return this;
        }

        public Builder<J> onError(ErrorHandler onError) {
            this.onError = onError;
            return this;
        }

        /**
         * Time source for due-time comparisons (useful for tests).
         */
        public Builder<J> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public SchedulerConfig<J> build() {
            return new SchedulerConfig<>(this);
        }
    }
}
