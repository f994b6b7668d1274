package io.notify4j.core;

import java.util.List;

/**
 * Per-user delivery preferences applied by the dispatcher before any transport call.
 *
 * @param windowStart start of the delivery window, {@code HH:mm} in {@code timezone}
 * @param windowEnd   end of the delivery window (inclusive); a window may wrap midnight
 * @param yachtsScope when non-empty, only notifications for these yachts are delivered
 */
public record NotificationPreference(
        String timezone,
        boolean inAppEnabled,
        boolean emailEnabled,
        boolean pushEnabled,
        String windowStart,
        String windowEnd,
        Severity minSeverity,
        List<String> yachtsScope
) {
    public NotificationPreference {
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
        windowStart = windowStart == null || windowStart.isBlank() ? "00:00" : windowStart;
        windowEnd = windowEnd == null || windowEnd.isBlank() ? "23:59" : windowEnd;
        minSeverity = minSeverity == null ? Severity.INFO : minSeverity;
        yachtsScope = yachtsScope == null ? List.of() : List.copyOf(yachtsScope);
    }

    public static NotificationPreference defaults() {
        return new NotificationPreference("UTC", true, true, false, "00:00", "23:59", Severity.INFO, List.of());
    }

    public boolean isEnabled(NotificationChannel channel) {
        return switch (channel) {
            case IN_APP -> inAppEnabled;
            case EMAIL -> emailEnabled;
            case PUSH -> pushEnabled;
        };
    }
}
