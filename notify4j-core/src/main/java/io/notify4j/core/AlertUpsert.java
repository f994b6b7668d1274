package io.notify4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Upsert command; on conflict only severity, due date and assignee are refreshed.
 */
public record AlertUpsert(
        String yachtId,
        String module,
        String alertType,
        Severity severity,
        String dedupeKey,
        String entityId,
        String assignedTo,
        Instant dueAt
) {
    public AlertUpsert {
        Objects.requireNonNull(yachtId, "yachtId must not be null");
        Objects.requireNonNull(dedupeKey, "dedupeKey must not be null");
    }
}
