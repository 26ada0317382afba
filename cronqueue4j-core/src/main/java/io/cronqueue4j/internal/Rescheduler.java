package io.cronqueue4j.internal;

import io.cronqueue4j.core.JobAccessor;
import io.cronqueue4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Finalizes a processed job: re-arms recurring jobs, and expires or deletes the rest.
 *
 * <p>Runs after the claim transaction has committed, using direct store writes by id.
 */
public class Rescheduler<J> {
    private static final Logger log = LoggerFactory.getLogger(Rescheduler.class);

    private final JobStore<J> jobStore;
    private final JobAccessor<J> accessor;
    private final IntervalCalculator<J> intervalCalculator;

    public Rescheduler(JobStore<J> jobStore, JobAccessor<J> accessor, IntervalCalculator<J> intervalCalculator) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
        this.intervalCalculator = Objects.requireNonNull(intervalCalculator, "intervalCalculator must not be null");
    }

    public void reschedule(J job) {
        String id = accessor.getId(job);
        Optional<Instant> next = intervalCalculator.nextStart(job);

        if (next.isPresent()) {
            jobStore.updateDueAt(id, next.get());
            log.debug("cronqueue job rescheduled id={} nextDueAt={}", id, next.get());
        } else if (accessor.isAutoRemove(job)) {
            jobStore.deleteById(id);
            log.debug("cronqueue job removed id={}", id);
        } else {
            jobStore.updateDueAt(id, null);
            log.debug("cronqueue job expired id={}", id);
        }
    }
}
