package io.notify4j.core;

import java.time.Instant;

/**
 * An open or resolved operational alert, unique per {@code dedupeKey}.
 */
public record Alert(
        String id,
        String yachtId,
        String module,
        String alertType,
        Severity severity,
        String dedupeKey,
        String entityId,
        String assignedTo,
        Instant dueAt,
        Instant createdAt,
        Instant resolvedAt
) {
    public boolean isOpen() {
        return resolvedAt == null;
    }
}
