package io.cronqueue4j.internal.mongo;

import io.cronqueue4j.core.JobAccessor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * Mongo document model for persisted cron jobs.
 */
@Document(collection = "cron_jobs")
public class CronJobDocument {

    public static final JobAccessor<CronJobDocument> ACCESSOR = new Accessor();

    @Id
    private String id;

    // written even when null so that an inert job keeps the field
    @Field(write = Field.Write.ALWAYS)
    private Instant sleepUntil;

    private String interval;
    private Instant repeatUntil;
    private boolean autoRemove;

    public CronJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Instant getSleepUntil() {
        return sleepUntil;
    }

    public void setSleepUntil(Instant sleepUntil) {
        this.sleepUntil = sleepUntil;
    }

    public String getInterval() {
        return interval;
    }

    public void setInterval(String interval) {
        this.interval = interval;
    }

    public Instant getRepeatUntil() {
        return repeatUntil;
    }

    public void setRepeatUntil(Instant repeatUntil) {
        this.repeatUntil = repeatUntil;
    }

    public boolean isAutoRemove() {
        return autoRemove;
    }

    public void setAutoRemove(boolean autoRemove) {
        this.autoRemove = autoRemove;
    }

    @Override
    public String toString() {
        return "CronJobDocument{id=" + id
                + ", sleepUntil=" + sleepUntil
                + ", interval=" + interval
                + ", repeatUntil=" + repeatUntil
                + ", autoRemove=" + autoRemove + '}';
    }

    private static final class Accessor implements JobAccessor<CronJobDocument> {
        @Override
        public CronJobDocument newInstance() {
            return new CronJobDocument();
        }

        @Override
        public String getId(CronJobDocument job) {
            return job.getId();
        }

        @Override
        public void setId(CronJobDocument job, String id) {
            job.setId(id);
        }

        @Override
        public Instant getDueAt(CronJobDocument job) {
            return job.getSleepUntil();
        }

        @Override
        public void setDueAt(CronJobDocument job, Instant dueAt) {
            job.setSleepUntil(dueAt);
        }

        @Override
        public String getInterval(CronJobDocument job) {
            return job.getInterval();
        }

        @Override
        public void setInterval(CronJobDocument job, String interval) {
            job.setInterval(interval);
        }

        @Override
        public Instant getRepeatUntil(CronJobDocument job) {
            return job.getRepeatUntil();
        }

        @Override
        public void setRepeatUntil(CronJobDocument job, Instant repeatUntil) {
            job.setRepeatUntil(repeatUntil);
        }

        @Override
        public boolean isAutoRemove(CronJobDocument job) {
            return job.isAutoRemove();
        }

        @Override
        public void setAutoRemove(CronJobDocument job, boolean autoRemove) {
            job.setAutoRemove(autoRemove);
        }
    }
}
