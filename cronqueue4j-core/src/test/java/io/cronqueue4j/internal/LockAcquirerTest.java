package io.cronqueue4j.internal;

import io.cronqueue4j.core.CronJob;
import io.cronqueue4j.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockAcquirerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Duration LOCK = Duration.ofMinutes(10);

    private InMemoryJobStore<CronJob> store;
    private LockAcquirer<CronJob> acquirer;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore<>(CronJob.ACCESSOR);
        acquirer = new LockAcquirer<>(store, CronJob.ACCESSOR, LOCK, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void claimShouldLockDueJobAndReturnPreLockSnapshot() {
        CronJob due = store.insert(job(NOW.minusSeconds(10)));

        Optional<CronJob> claimed = acquirer.claim();

        assertTrue(claimed.isPresent());
        assertEquals(due.getId(), claimed.get().getId());
        assertEquals(NOW.minusSeconds(10), claimed.get().getSleepUntil());
        assertEquals(NOW.plus(LOCK), store.findById(due.getId()).orElseThrow().getSleepUntil());
    }

    @Test
    void claimShouldAcceptJobDueExactlyNow() {
        store.insert(job(NOW));

        assertTrue(acquirer.claim().isPresent());
    }

    @Test
    void claimShouldIgnoreFutureAndInertJobs() {
        store.insert(job(NOW.plusSeconds(100)));
        store.insert(job(null));

        assertTrue(acquirer.claim().isEmpty());
    }

    @Test
    void lockedJobShouldNotBeClaimedAgain() {
        store.insert(job(NOW.minusSeconds(10)));

        assertTrue(acquirer.claim().isPresent());
        assertTrue(acquirer.claim().isEmpty());
    }

    @Test
    void claimShouldTakeOneJobPerCall() {
        store.insert(job(NOW.minusSeconds(20)));
        store.insert(job(NOW.minusSeconds(10)));

        assertEquals(NOW.minusSeconds(20), acquirer.claim().orElseThrow().getSleepUntil());
        assertEquals(NOW.minusSeconds(10), acquirer.claim().orElseThrow().getSleepUntil());
        assertTrue(acquirer.claim().isEmpty());
    }

    @Test
    void concurrentClaimsShouldNeverReturnTheSameJobTwice() throws Exception {
        store.insert(job(Instant.now().minusSeconds(10)));

        int instances = 8;
        ExecutorService pool = Executors.newFixedThreadPool(instances);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<CronJob>>> results = new ArrayList<>();
            for (int i = 0; i < instances; i++) {
                LockAcquirer<CronJob> instance = new LockAcquirer<>(store, CronJob.ACCESSOR, LOCK, Clock.systemUTC());
                results.add(pool.submit(() -> {
                    go.await();
                    return instance.claim();
                }));
            }
            go.countDown();

            int claimed = 0;
            for (Future<Optional<CronJob>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isPresent()) {
                    claimed++;
                }
            }
            assertEquals(1, claimed);
        } finally {
            pool.shutdownNow();
        }
    }

    private static CronJob job(Instant dueAt) {
        CronJob job = new CronJob();
        job.setSleepUntil(dueAt);
        return job;
    }
}
