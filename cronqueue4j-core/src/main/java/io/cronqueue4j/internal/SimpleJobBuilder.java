package io.cronqueue4j.internal;

import io.cronqueue4j.JobBuilder;
import io.cronqueue4j.core.JobSpec;
import io.cronqueue4j.cron.CronExpressionEngine;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation.
 */
public class SimpleJobBuilder<J> implements JobBuilder<J> {

    private final CronExpressionEngine cronEngine;
    private final Clock clock;
    private final Function<JobSpec, J> persister;

    private Instant dueAt;
    private String interval;
    private Instant repeatUntil;
    private boolean autoRemove;
    private boolean skipImmediate = RepeatOptions.defaults().skipImmediate();

    public SimpleJobBuilder(CronExpressionEngine cronEngine, Clock clock, Function<JobSpec, J> persister) {
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
    }

    @Override
    public JobBuilder<J> schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.dueAt = time;
        return this;
    }

    @Override
    public JobBuilder<J> repeatEvery(String cron) {
        return repeatEvery(cron, RepeatOptions.defaults());
    }

    @Override
    public JobBuilder<J> repeatEvery(String cron, RepeatOptions options) {
        Objects.requireNonNull(cron, "cron must not be null");
        if (cron.isBlank()) {
            throw new IllegalArgumentException("cron must not be blank");
        }
        if (!cronEngine.isValid(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }

        if (options == null) {
            options = RepeatOptions.defaults();
        }

        this.interval = cron.trim();
        this.skipImmediate = options.skipImmediate();
        return this;
    }

    @Override
    public JobBuilder<J> repeatUntil(Instant until) {
        Objects.requireNonNull(until, "until must not be null");
        this.repeatUntil = until;
        return this;
    }

    @Override
    public JobBuilder<J> autoRemove(boolean autoRemove) {
        this.autoRemove = autoRemove;
        return this;
    }

    @Override
    public JobSpec build() {
        Instant first = dueAt;
        if (first == null) {
            if (interval == null) {
                throw new IllegalStateException("Job has no due time: call schedule(...) or repeatEvery(...)");
            }
            Instant now = clock.instant();
            first = skipImmediate ? cronEngine.next(interval, now, repeatUntil) : now;
        }

        return new JobSpec(
                first,
                interval,
                repeatUntil,
                autoRemove
        );
    }

    @Override
    public J save() {
        return persister.apply(build());
    }
}
