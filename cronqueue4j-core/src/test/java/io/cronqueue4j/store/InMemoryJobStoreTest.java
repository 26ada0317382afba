package io.cronqueue4j.store;

import io.cronqueue4j.core.CronJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryJobStore<CronJob> store;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore<>(CronJob.ACCESSOR);
    }

    @Test
    void insertShouldAssignIdAndDetachEntity() {
        CronJob input = job(NOW);
        CronJob stored = store.insert(input);

        assertNotNull(stored.getId());
        assertNull(input.getId());

        stored.setSleepUntil(null);
        assertEquals(NOW, store.findById(stored.getId()).orElseThrow().getSleepUntil());
    }

    @Test
    void insertShouldRejectDuplicateId() {
        CronJob job = job(NOW);
        job.setId("fixed");
        store.insert(job);

        assertThrows(IllegalStateException.class, () -> store.insert(job));
    }

    @Test
    void findOneDueShouldRequireNonNullDueTimeNotAfterNow() {
        store.insert(job(null));
        store.insert(job(NOW.plusMillis(1)));

        assertTrue(store.transaction(tx -> tx.findOneDue(NOW)).isEmpty());

        CronJob due = store.insert(job(NOW));
        assertEquals(due.getId(), store.transaction(tx -> tx.findOneDue(NOW)).orElseThrow().getId());
    }

    @Test
    void findOneDueShouldPreferEarliestDueJob() {
        store.insert(job(NOW.minusSeconds(5)));
        CronJob earliest = store.insert(job(NOW.minusSeconds(50)));

        Optional<CronJob> found = store.transaction(tx -> tx.findOneDue(NOW));

        assertEquals(earliest.getId(), found.orElseThrow().getId());
    }

    @Test
    void snapshotShouldNotSeeLaterWritesInSameTransaction() {
        CronJob due = store.insert(job(NOW.minusSeconds(5)));

        CronJob snapshot = store.transaction(tx -> {
            CronJob found = tx.findOneDue(NOW).orElseThrow();
            tx.updateDueAt(found.getId(), NOW.plusSeconds(600));
            return found;
        });

        assertEquals(NOW.minusSeconds(5), snapshot.getSleepUntil());
        assertEquals(NOW.plusSeconds(600), store.findById(due.getId()).orElseThrow().getSleepUntil());
    }

    @Test
    void failedTransactionShouldRollBack() {
        CronJob due = store.insert(job(NOW.minusSeconds(5)));

        assertThrows(IllegalStateException.class, () -> store.transaction(tx -> {
            tx.updateDueAt(due.getId(), NOW.plusSeconds(600));
            tx.deleteById(due.getId());
            throw new IllegalStateException("simulated failure");
        }));

        assertEquals(NOW.minusSeconds(5), store.findById(due.getId()).orElseThrow().getSleepUntil());
    }

    @Test
    void directWritesShouldReportAffectedCount() {
        CronJob job = store.insert(job(NOW));

        assertEquals(1, store.updateDueAt(job.getId(), null));
        assertNull(store.findById(job.getId()).orElseThrow().getSleepUntil());
        assertEquals(0, store.updateDueAt("missing", NOW));

        assertEquals(1, store.deleteById(job.getId()));
        assertEquals(0, store.deleteById(job.getId()));
        assertEquals(0, store.count());
    }

    private static CronJob job(Instant dueAt) {
        CronJob job = new CronJob();
        job.setSleepUntil(dueAt);
        return job;
    }
}
