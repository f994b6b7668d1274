package io.notify4j.core;

import java.util.List;

/**
 * A reminder fired {@code offsetHours} before a job's next run on each listed channel.
 */
public record ReminderPolicy(int offsetHours, List<NotificationChannel> channels) {

    public ReminderPolicy {
        channels = channels == null ? List.of() : List.copyOf(channels);
    }

    public static ReminderPolicy of(int offsetHours, NotificationChannel... channels) {
        return new ReminderPolicy(offsetHours, List.of(channels));
    }
}
