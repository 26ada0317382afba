package io.cronqueue4j.internal;

import io.cronqueue4j.core.JobAccessor;
import io.cronqueue4j.cron.CronExpressionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes the next due time of a processed job, or reports that it has expired.
 */
public class IntervalCalculator<J> {
    private static final Logger log = LoggerFactory.getLogger(IntervalCalculator.class);

    private final JobAccessor<J> accessor;
    private final CronExpressionEngine cronEngine;
    private final Duration reprocessDelay;
    private final Clock clock;

    public IntervalCalculator(JobAccessor<J> accessor, CronExpressionEngine cronEngine, Duration reprocessDelay, Clock clock) {
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.cronEngine = Objects.requireNonNull(cronEngine, "cronEngine must not be null");
        this.reprocessDelay = Objects.requireNonNull(reprocessDelay, "reprocessDelay must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Returns the next due time for {@code job}, or empty when the job is one-shot or has expired.
     *
     * @param job pre-lock snapshot (its due time is the occurrence that was just processed)
     */
    public Optional<Instant> nextStart(J job) {
        if (!accessor.isRecurring(job)) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        Instant dueAt = accessor.getDueAt(job);
        Instant after = (dueAt != null ? dueAt : now).plus(reprocessDelay);
        Instant repeatUntil = accessor.getRepeatUntil(job);

        Instant candidate;
        try {
            candidate = cronEngine.next(accessor.getInterval(job), after, repeatUntil);
        } catch (IllegalArgumentException e) {
            log.debug("cronqueue job expired id={} interval={} msg={}", accessor.getId(job), accessor.getInterval(job), e.getMessage());
            return Optional.empty();
        }

        // run overdue occurrences once, now, instead of replaying each missed one
        if (candidate.isBefore(now)) {
            if (repeatUntil != null && !now.isBefore(repeatUntil)) {
                return Optional.empty();
            }
            return Optional.of(now);
        }
        return Optional.of(candidate);
    }
}
