package io.cronqueue4j.core;

/**
 * Snapshot of the scheduler loop state.
 *
 * <p>{@code running=false} is the stopped state. While stopping, {@code processing} may still be true
 * until the in-flight tick drains. {@code idle} records that the most recent claim attempt found no job.
 */
public record SchedulerState(
        boolean running,
        boolean processing,
        boolean idle
) {

    private static final SchedulerState STOPPED = new SchedulerState(false, false, false);

    public static SchedulerState stopped() {
        return STOPPED;
    }

    public SchedulerState start() {
        return new SchedulerState(true, false, false);
    }

    public SchedulerState stop() {
        return new SchedulerState(false, processing, idle);
    }

    public SchedulerState beginProcessing() {
        return new SchedulerState(running, true, idle);
    }

    public SchedulerState jobFound() {
        return new SchedulerState(running, true, false);
    }

    public SchedulerState noJobFound() {
        return new SchedulerState(running, false, true);
    }

    public SchedulerState endProcessing() {
        return new SchedulerState(running, false, idle);
    }
}
