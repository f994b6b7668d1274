package io.notify4j.core;

import java.time.Duration;

/**
 * Framework-free tuning knobs of the job scheduler.
 *
 * @param dueBatchSize          max due jobs executed per tick
 * @param reminderBatchSize     max jobs scanned for reminders per tick
 * @param reminderLookahead     how far ahead of now a job's next run is considered for reminders
 * @param overdueThreshold      a run scheduled longer ago than this is critical
 * @param runDedupeWindowHours  in-app dedupe window used for run and reminder sends
 */
public record SchedulerOptions(
        int dueBatchSize,
        int reminderBatchSize,
        Duration reminderLookahead,
        Duration overdueThreshold,
        int runDedupeWindowHours
) {
    public SchedulerOptions {
        if (dueBatchSize < 1) {
            throw new IllegalArgumentException("dueBatchSize must be >= 1");
        }
        if (reminderBatchSize < 1) {
            throw new IllegalArgumentException("reminderBatchSize must be >= 1");
        }
        if (runDedupeWindowHours < 1) {
            throw new IllegalArgumentException("runDedupeWindowHours must be >= 1");
        }
        reminderLookahead = reminderLookahead == null ? Duration.ofDays(7) : reminderLookahead;
        overdueThreshold = overdueThreshold == null ? Duration.ofMinutes(30) : overdueThreshold;
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(50, 100, Duration.ofDays(7), Duration.ofMinutes(30), 24);
    }
}
