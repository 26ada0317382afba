package io.cronqueue4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for CronQueue scheduler behavior.
 */
@ConfigurationProperties(prefix = "cronqueue")
public class CronQueueProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private Duration nextDelay = SchedulerConfig.DEFAULT_NEXT_DELAY;
    private Duration idleDelay = SchedulerConfig.DEFAULT_IDLE_DELAY;
    private Duration lockDuration = SchedulerConfig.DEFAULT_LOCK_DURATION;
    private Duration reprocessDelay = SchedulerConfig.DEFAULT_REPROCESS_DELAY;
    private String timezone; // cron evaluation zone, system default when unset
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Duration getNextDelay() {
        return nextDelay;
    }

    public void setNextDelay(Duration nextDelay) {
        this.nextDelay = nextDelay;
    }

    public Duration getIdleDelay() {
        return idleDelay;
    }

    public void setIdleDelay(Duration idleDelay) {
        this.idleDelay = idleDelay;
    }

    public Duration getLockDuration() {
        return lockDuration;
    }

    public void setLockDuration(Duration lockDuration) {
        this.lockDuration = lockDuration;
    }

    public Duration getReprocessDelay() {
        return reprocessDelay;
    }

    public void setReprocessDelay(Duration reprocessDelay) {
        this.reprocessDelay = reprocessDelay;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    /**
     * Apply the timings of these properties to a scheduler config builder.
     */
    public <J> SchedulerConfig.Builder<J> applyTo(SchedulerConfig.Builder<J> builder) {
        return builder
                .nextDelay(nextDelay)
                .idleDelay(idleDelay)
                .lockDuration(lockDuration)
                .reprocessDelay(reprocessDelay);
    }
}
