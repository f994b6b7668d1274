package io.notify4j.core;

import java.util.OptionalInt;

/**
 * Parsed form of the supported cron subset: {@code m h * * *} or {@code m h * * d}.
 *
 * @param minute    0..59
 * @param hour      0..23
 * @param dayOfWeek 0..6 (0 = Sunday), or {@code null} for every day
 */
public record CronSchedule(int minute, int hour, Integer dayOfWeek) {

    public CronSchedule {
        if (minute < 0 || minute > 59) {
            throw new ValidationException("cron minute must be within 0..59: " + minute);
        }
        if (hour < 0 || hour > 23) {
            throw new ValidationException("cron hour must be within 0..23: " + hour);
        }
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new ValidationException("cron day-of-week must be within 0..6: " + dayOfWeek);
        }
    }

    public OptionalInt weekday() {
        return dayOfWeek == null ? OptionalInt.empty() : OptionalInt.of(dayOfWeek);
    }
}
