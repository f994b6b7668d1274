package io.notify4j.utils;

import io.notify4j.core.CronSchedule;
import io.notify4j.core.JobSchedule;
import io.notify4j.core.ScheduleType;
import io.notify4j.core.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TimeZone;

/**
 * Validates job schedules and computes their next run time.
 * <p>
 * Supported shapes:
 * <ul>
 *   <li>{@code interval_hours}: every N hours (1..720)</li>
 *   <li>{@code interval_days}: every N days (1..365)</li>
 *   <li>{@code cron}: 5-field {@code "m h * * *"} or {@code "m h * * d"} (day of week 0-6, Sunday = 0)</li>
 * </ul>
 * <p>
 * Note: all arithmetic is UTC. The schedule's timezone is persisted but not applied.
 */
public final class ScheduleCalculator {

    public static final int MAX_EVERY_HOURS = 720;
    public static final int MAX_EVERY_DAYS = 365;

    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private ScheduleCalculator() {
    }

    /**
     * Validate and canonicalize a schedule: trimmed cron expression, only the fields its type uses,
     * and a default timezone of {@code UTC}.
     */
    public static JobSchedule normalize(JobSchedule schedule) {
        if (schedule == null || schedule.type() == null) {
            throw new ValidationException("schedule type is required");
        }
        String timezone = schedule.timezone() == null || schedule.timezone().isBlank()
                ? JobSchedule.DEFAULT_TIMEZONE
                : schedule.timezone().trim();

        return switch (schedule.type()) {
            case INTERVAL_HOURS -> {
                Integer hours = schedule.everyHours();
                if (hours == null || hours < 1) {
                    throw new ValidationException("everyHours is required for interval_hours schedules");
                }
                if (hours > MAX_EVERY_HOURS) {
                    throw new ValidationException("everyHours must be <= " + MAX_EVERY_HOURS);
                }
                yield new JobSchedule(ScheduleType.INTERVAL_HOURS, null, hours, null, timezone);
            }
            case INTERVAL_DAYS -> {
                Integer days = schedule.everyDays();
                if (days == null || days < 1) {
                    throw new ValidationException("everyDays is required for interval_days schedules");
                }
                if (days > MAX_EVERY_DAYS) {
                    throw new ValidationException("everyDays must be <= " + MAX_EVERY_DAYS);
                }
                yield new JobSchedule(ScheduleType.INTERVAL_DAYS, null, null, days, timezone);
            }
            case CRON -> {
                String expression = schedule.expression() == null ? "" : schedule.expression().trim();
                parseCron(expression);
                yield new JobSchedule(ScheduleType.CRON, expression, null, null, timezone);
            }
        };
    }

    /**
     * Parse the restricted cron grammar. Day-of-month and month must be {@code *}.
     *
     * @throws ValidationException for any other shape
     */
    public static CronSchedule parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("cron expression is required for cron schedules");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5 || !"*".equals(parts[2]) || !"*".equals(parts[3])) {
            throw unsupported(expression);
        }
        int minute = parseField(parts[0], 59, expression);
        int hour = parseField(parts[1], 23, expression);
        Integer dayOfWeek = "*".equals(parts[4]) ? null : parseField(parts[4], 6, expression);
        return new CronSchedule(minute, hour, dayOfWeek);
    }

    /**
     * Compute the next run strictly after {@code from}.
     */
    public static Instant computeNextRunAt(JobSchedule schedule, Instant from) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(from, "from must not be null");

        return switch (schedule.type()) {
            case INTERVAL_HOURS -> from.plus(Duration.ofHours(requirePositive(schedule.everyHours(), "everyHours")));
            case INTERVAL_DAYS -> from.plus(Duration.ofDays(requirePositive(schedule.everyDays(), "everyDays")));
            case CRON -> nextCronOccurrence(parseCron(schedule.expression()), from);
        };
    }

    /**
     * Quartz form of a restricted cron schedule (seconds pinned to 0, Quartz weekdays are 1-based).
     */
    public static String toQuartzCron(CronSchedule cron) {
        OptionalInt weekday = cron.weekday();
        String dayOfMonth = weekday.isPresent() ? "?" : "*";
        String dayOfWeek = weekday.isPresent() ? String.valueOf(weekday.getAsInt() + 1) : "?";
        return String.join(" ", "0", String.valueOf(cron.minute()), String.valueOf(cron.hour()),
                dayOfMonth, "*", dayOfWeek);
    }

    private static Instant nextCronOccurrence(CronSchedule cron, Instant from) {
        String quartz = toQuartzCron(cron);
        CronExpression exp;
        try {
            exp = new CronExpression(quartz);
        } catch (ParseException ex) {
            throw new ValidationException("Invalid cron expression: " + quartz, ex);
        }
        exp.setTimeZone(UTC);

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalStateException("Cron expression produced no next execution time: " + quartz);
        }
        return next.toInstant();
    }

    private static int parseField(String token, int max, String expression) {
        if (!token.matches("^\\d{1,2}$")) {
            throw unsupported(expression);
        }
        int value = Integer.parseInt(token);
        if (value > max) {
            throw unsupported(expression);
        }
        return value;
    }

    private static int requirePositive(Integer value, String field) {
        if (value == null || value < 1) {
            throw new ValidationException(field + " must be a positive integer");
        }
        return value;
    }

    private static ValidationException unsupported(String expression) {
        return new ValidationException(
                "Unsupported cron expression (expected \"m h * * *\" or \"m h * * d\"): " + expression);
    }
}
