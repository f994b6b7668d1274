package io.notify4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded channel attempt. Idempotence is checked against prior entries sharing the dedupe key.
 */
public record LedgerEntry(
        String id,
        String userId,
        String yachtId,
        NotificationChannel channel,
        String type,
        String dedupeKey,
        DeliveryStatus status,
        Map<String, Object> payload,
        Instant createdAt,
        Instant sentAt,
        String error
) {
    public LedgerEntry {
        payload = payload == null ? Map.of() : payload;
    }

    public LedgerEntry withId(String newId) {
        return new LedgerEntry(newId, userId, yachtId, channel, type, dedupeKey, status, payload, createdAt, sentAt, error);
    }

    public LedgerEntry withStatus(DeliveryStatus newStatus) {
        return new LedgerEntry(id, userId, yachtId, channel, type, dedupeKey, newStatus, payload, createdAt, sentAt, error);
    }
}
