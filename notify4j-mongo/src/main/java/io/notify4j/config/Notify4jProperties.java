package io.notify4j.config;

import io.notify4j.core.SchedulerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the notification scheduler and dispatch engine.
 */
@ConfigurationProperties(prefix = "notify4j")
public class Notify4jProperties {
    private boolean enabled = true;
    private boolean schedulerEnabled = true;
    private Duration processEvery = Duration.ofMinutes(5);
    private int dueBatchSize = 50;
    private int reminderBatchSize = 100;
    private Duration reminderLookahead = Duration.ofDays(7);
    private Duration overdueThreshold = Duration.ofMinutes(30);
    private int runDedupeWindowHours = 24; // in-app window for run and reminder sends
    private boolean ensureIndexesOnStartup = false;

    public SchedulerOptions toSchedulerOptions() {
        return new SchedulerOptions(
                dueBatchSize,
                reminderBatchSize,
                reminderLookahead,
                overdueThreshold,
                runDedupeWindowHours
        );
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getDueBatchSize() {
        return dueBatchSize;
    }

    public void setDueBatchSize(int dueBatchSize) {
        this.dueBatchSize = dueBatchSize;
    }

    public int getReminderBatchSize() {
        return reminderBatchSize;
    }

    public void setReminderBatchSize(int reminderBatchSize) {
        this.reminderBatchSize = reminderBatchSize;
    }

    public Duration getReminderLookahead() {
        return reminderLookahead;
    }

    public void setReminderLookahead(Duration reminderLookahead) {
        this.reminderLookahead = reminderLookahead;
    }

    public Duration getOverdueThreshold() {
        return overdueThreshold;
    }

    public void setOverdueThreshold(Duration overdueThreshold) {
        this.overdueThreshold = overdueThreshold;
    }

    public int getRunDedupeWindowHours() {
        return runDedupeWindowHours;
    }

    public void setRunDedupeWindowHours(int runDedupeWindowHours) {
        this.runDedupeWindowHours = runDedupeWindowHours;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
