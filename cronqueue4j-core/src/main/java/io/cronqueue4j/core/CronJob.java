package io.cronqueue4j.core;

import java.time.Instant;

/**
 * Plain job entity for stores that do not need mapping annotations (e.g. the in-memory store).
 */
public class CronJob {

    public static final JobAccessor<CronJob> ACCESSOR = new Accessor();

    private String id;
    private Instant sleepUntil;
    private String interval;
    private Instant repeatUntil;
    private boolean autoRemove;

    public CronJob() {
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
        return "CronJob{id=" + id
                + ", sleepUntil=" + sleepUntil
                + ", interval=" + interval
                + ", repeatUntil=" + repeatUntil
                + ", autoRemove=" + autoRemove + '}';
    }

    private static final class Accessor implements JobAccessor<CronJob> {
        @Override
        public CronJob newInstance() {
            return new CronJob();
        }

        @Override
        public String getId(CronJob job) {
            return job.getId();
        }

        @Override
        public void setId(CronJob job, String id) {
            job.setId(id);
        }

        @Override
        public Instant getDueAt(CronJob job) {
            return job.getSleepUntil();
        }

        @Override
        public void setDueAt(CronJob job, Instant dueAt) {
            job.setSleepUntil(dueAt);
        }

        @Override
        public String getInterval(CronJob job) {
            return job.getInterval();
        }

        @Override
        public void setInterval(CronJob job, String interval) {
            job.setInterval(interval);
        }

        @Override
        public Instant getRepeatUntil(CronJob job) {
            return job.getRepeatUntil();
        }

        @Override
        public void setRepeatUntil(CronJob job, Instant repeatUntil) {
            job.setRepeatUntil(repeatUntil);
        }

        @Override
        public boolean isAutoRemove(CronJob job) {
            return job.isAutoRemove();
        }

        @Override
        public void setAutoRemove(CronJob job, boolean autoRemove) {
            job.setAutoRemove(autoRemove);
        }
    }
}
