package io.cronqueue4j.store;

import io.cronqueue4j.core.JobAccessor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Process-local {@link JobStore}.
 *
 * <p>Transactions are serialized by a single lock and work on a staged copy of the rows that replaces
 * the live rows only when the transaction body returns normally. Entities are copied on the way in
 * and out, so callers never share mutable state with the store.
 */
public class InMemoryJobStore<J> implements JobStore<J> {

    private final JobAccessor<J> accessor;
    private final ReentrantLock lock = new ReentrantLock();
    private Map<String, J> rows = new LinkedHashMap<>();

    public InMemoryJobStore(JobAccessor<J> accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor must not be null");
    }

    @Override
    public <R> R transaction(Function<JobTransaction<J>, R> work) {
        Objects.requireNonNull(work, "work must not be null");
        lock.lock();
        try {
            Map<String, J> staged = new LinkedHashMap<>();
            rows.forEach((id, job) -> staged.put(id, accessor.copy(job)));

            R result = work.apply(new StagedTransaction(staged));
            rows = staged;
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long updateDueAt(String id, Instant dueAt) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            return setDueAt(rows, id, dueAt);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        lock.lock();
        try {
            return rows.remove(id) != null ? 1 : 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public J insert(J job) {
        Objects.requireNonNull(job, "job must not be null");
        J stored = accessor.copy(job);
        if (accessor.getId(stored) == null) {
            accessor.setId(stored, UUID.randomUUID().toString());
        }
        lock.lock();
        try {
            String id = accessor.getId(stored);
            if (rows.containsKey(id)) {
                throw new IllegalStateException("Duplicate job id: " + id);
            }
            rows.put(id, stored);
        } finally {
            lock.unlock();
        }
        return accessor.copy(stored);
    }

    @Override
    public Optional<J> findById(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(rows.get(id)).map(accessor::copy);
        } finally {
            lock.unlock();
        }
    }

    public List<J> findAll() {
        lock.lock();
        try {
            List<J> all = new ArrayList<>(rows.size());
            rows.values().forEach(job -> all.add(accessor.copy(job)));
            return all;
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return rows.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            rows = new LinkedHashMap<>();
        } finally {
            lock.unlock();
        }
    }

    private long setDueAt(Map<String, J> target, String id, Instant dueAt) {
        J job = target.get(id);
        if (job == null) {
            return 0;
        }
        accessor.setDueAt(job, dueAt);
        return 1;
    }

    private final class StagedTransaction implements JobTransaction<J> {
        private final Map<String, J> staged;

        private StagedTransaction(Map<String, J> staged) {
            this.staged = staged;
        }

        @Override
        public Optional<J> findOneDue(Instant now) {
            Objects.requireNonNull(now, "now must not be null");
            // earliest due first; ties keep insertion order
            return staged.values().stream()
                    .filter(job -> accessor.getDueAt(job) != null)
                    .filter(job -> !accessor.getDueAt(job).isAfter(now))
                    .min(Comparator.comparing(accessor::getDueAt))
                    .map(accessor::copy);
        }

        @Override
        public long updateDueAt(String id, Instant dueAt) {
            Objects.requireNonNull(id, "id must not be null");
            return setDueAt(staged, id, dueAt);
        }

        @Override
        public long deleteById(String id) {
            Objects.requireNonNull(id, "id must not be null");
            return staged.remove(id) != null ? 1 : 0;
        }
    }
}
