package io.cronqueue4j.internal.mongo;

import io.cronqueue4j.store.JobStore;
import io.cronqueue4j.store.JobTransaction;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>{@link #transaction(Function)} runs inside a MongoDB multi-document transaction, so the server must
 * be a replica set (or sharded cluster). Two schedulers racing for the same due document both read it,
 * but only one update commits; the other transaction aborts with a write conflict that surfaces as an
 * exception from {@code transaction}.
 *
 * @param <J> mapped document type
 */
public class MongoJobStore<J> implements JobStore<J> {

    public static final String DEFAULT_DUE_AT_FIELD = "sleepUntil";

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Class<J> documentType;
    private final String dueAtField;

    public MongoJobStore(MongoTemplate mongoTemplate,
                         MongoTransactionManager transactionManager,
                         Class<J> documentType,
                         String dueAtField) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        Objects.requireNonNull(transactionManager, "transactionManager must not be null");
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.documentType = Objects.requireNonNull(documentType, "documentType must not be null");
        if (dueAtField == null || dueAtField.isBlank()) {
            throw new IllegalArgumentException("dueAtField must not be blank");
        }
        this.dueAtField = dueAtField;
    }

    /**
     * Store bound to {@link CronJobDocument} and its {@code sleepUntil} field.
     */
    public static MongoJobStore<CronJobDocument> forCronJobs(MongoTemplate mongoTemplate,
                                                             MongoTransactionManager transactionManager) {
        return new MongoJobStore<>(mongoTemplate, transactionManager, CronJobDocument.class,
                DEFAULT_DUE_AT_FIELD);
    }

    @Override
    public <R> R transaction(Function<JobTransaction<J>, R> work) {
        Objects.requireNonNull(work, "work must not be null");
        return transactionTemplate.execute(status -> work.apply(new MongoJobTransaction()));
    }

    @Override
    public long updateDueAt(String id, Instant dueAt) {
        Objects.requireNonNull(id, "id must not be null");
        return mongoTemplate.updateFirst(byId(id), new Update().set(dueAtField, dueAt), documentType)
                .getMatchedCount();
    }

    /**
     * Hard delete job by document id.
     *
     * @return deleted count (0 or 1 normally)
     */
    @Override
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return mongoTemplate.remove(byId(id), documentType).getDeletedCount();
    }

    @Override
    public J insert(J job) {
        Objects.requireNonNull(job, "job must not be null");
        return mongoTemplate.insert(job);
    }

    @Override
    public Optional<J> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, documentType));
    }

    public Class<J> getDocumentType() {
        return documentType;
    }

    public String getDueAtField() {
        return dueAtField;
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    /**
     * Operations issued through the session bound by the surrounding {@link TransactionTemplate}.
     */
    private final class MongoJobTransaction implements JobTransaction<J> {

        @Override
        public Optional<J> findOneDue(Instant now) {
            Objects.requireNonNull(now, "now must not be null");
            // {field: {$ne: null, $lte: now}}
            Query q = new Query(Criteria.where(dueAtField).ne(null).lte(now))
                    .with(Sort.by(Sort.Direction.ASC, dueAtField))
                    .limit(1);
            return Optional.ofNullable(mongoTemplate.findOne(q, documentType));
        }

        @Override
        public long updateDueAt(String id, Instant dueAt) {
            return MongoJobStore.this.updateDueAt(id, dueAt);
        }

        @Override
        public long deleteById(String id) {
            return MongoJobStore.this.deleteById(id);
        }
    }
}
