package io.cronqueue4j.config;

import io.cronqueue4j.internal.mongo.CronJobDocument;
import io.cronqueue4j.internal.mongo.MongoJobStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the CronQueue module.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code cronqueue.ensure-indexes-on-startup=true}. In production they are usually managed by DB
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code cron_jobs})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { sleepUntil: 1 }
 *       <br/>Used by the claim query (set and due) and its earliest-first ordering.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.cron_jobs.createIndex({ sleepUntil: 1 }, { name: "idx_due_claim" });
 * </pre>
 */
public class CronQueueMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";

    private final MongoTemplate mongoTemplate;

    public CronQueueMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure required indexes for CronQueue.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(dueClaimIndex());
    }

    /**
     * Index for claiming due jobs.
     * Keys: sleepUntil ASC
     */
    public static Index dueClaimIndex() {
        return new Index()
                .on(MongoJobStore.DEFAULT_DUE_AT_FIELD, Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }
}
