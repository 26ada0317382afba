package io.cronqueue4j.internal;

import io.cronqueue4j.core.JobAccessor;
import io.cronqueue4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Atomically claims (locks) at most one due job.
 *
 * <p>A job is due when its due time is set and {@code <= now}. Claiming pushes the due time to
 * {@code now + lockDuration}, so no other instance sees the job as due until the lock lapses.
 * Find and update run in one store transaction; that is the only thing preventing a double claim.
 */
public class LockAcquirer<J> {
    private static final Logger log = LoggerFactory.getLogger(LockAcquirer.class);

    private final JobStore<J> jobStore;
    private final JobAccessor<J> accessor;
    private final Duration lockDuration;
    private final Clock clock;

    public LockAcquirer(JobStore<J> jobStore, JobAccessor<J> accessor, Duration lockDuration, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.lockDuration = Objects.requireNonNull(lockDuration, "lockDuration must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (lockDuration.isNegative()) {
            throw new IllegalArgumentException("lockDuration must not be negative");
        }
    }

    /**
     * @return the pre-lock snapshot of the claimed job, or empty when nothing is due
     */
    public Optional<J> claim() {
        Instant now = clock.instant();
        Instant lockUntil = now.plus(lockDuration);

        Optional<J> claimed = jobStore.transaction(tx -> {
            Optional<J> due = tx.findOneDue(now);
            due.ifPresent(job -> tx.updateDueAt(accessor.getId(job), lockUntil));
            return due;
        });

        claimed.ifPresent(job -> log.debug("cronqueue claimed job id={} dueAt={} lockUntil={}",
                accessor.getId(job), accessor.getDueAt(job), lockUntil));
        return claimed;
    }
}
