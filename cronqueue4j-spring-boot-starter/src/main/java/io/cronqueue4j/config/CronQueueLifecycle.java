package io.cronqueue4j.config;

import io.cronqueue4j.CronQueue;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges CronQueue start/stop lifecycle with the Spring container lifecycle.
 */
public class CronQueueLifecycle implements SmartLifecycle {
    private final CronQueue<?> cronQueue;
    private final boolean autoStartup;

    public CronQueueLifecycle(CronQueue<?> cronQueue, boolean autoStartup) {
        this.cronQueue = cronQueue;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        cronQueue.start();
    }

    @Override
    public void stop() {
        cronQueue.stop();
    }

    @Override
    public boolean isRunning() {
        return cronQueue.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
