package io.notify4j.core;

/**
 * Persisted schedule shape: {@code {type, expression|null, everyHours|null, everyDays|null, timezone}}.
 *
 * <p>The timezone is carried through but next-run arithmetic is done in UTC.
 */
public record JobSchedule(
        ScheduleType type,
        String expression,
        Integer everyHours,
        Integer everyDays,
        String timezone
) {
    public static final String DEFAULT_TIMEZONE = "UTC";

    public static JobSchedule everyHours(int hours) {
        return new JobSchedule(ScheduleType.INTERVAL_HOURS, null, hours, null, DEFAULT_TIMEZONE);
    }

    public static JobSchedule everyDays(int days) {
        return new JobSchedule(ScheduleType.INTERVAL_DAYS, null, null, days, DEFAULT_TIMEZONE);
    }

    public static JobSchedule cron(String expression) {
        return new JobSchedule(ScheduleType.CRON, expression, null, null, DEFAULT_TIMEZONE);
    }
}
