package io.notify4j.core;

import java.util.Map;
import java.util.Objects;

/**
 * Input of a single channel attempt.
 *
 * @param dedupeWindowHours in-app dedupe window; {@code null} means the default of 24 hours
 */
public record NotificationRequest(
        String userId,
        String yachtId,
        String type,
        String dedupeKey,
        Severity severity,
        Map<String, Object> payload,
        Integer dedupeWindowHours
) {
    public NotificationRequest {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(dedupeKey, "dedupeKey must not be null");
        severity = severity == null ? Severity.INFO : severity;
        payload = payload == null ? Map.of() : payload;
    }
}
