package io.notify4j.internal;

import io.notify4j.core.Alert;
import io.notify4j.core.AlertUpsert;
import io.notify4j.spi.AlertStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class InMemoryAlertStore implements AlertStore {
    final Map<String, Alert> alerts = new LinkedHashMap<>();

    @Override
    public Alert upsert(AlertUpsert u, Instant now) {
        Alert existing = alerts.get(u.dedupeKey());
        Alert alert = existing == null
                ? new Alert("alert-" + (alerts.size() + 1), u.yachtId(), u.module(), u.alertType(), u.severity(),
                        u.dedupeKey(), u.entityId(), u.assignedTo(), u.dueAt(), now, null)
                : new Alert(existing.id(), existing.yachtId(), existing.module(), existing.alertType(), u.severity(),
                        existing.dedupeKey(), existing.entityId(), u.assignedTo(), u.dueAt(), existing.createdAt(),
                        existing.resolvedAt());
        alerts.put(u.dedupeKey(), alert);
        return alert;
    }

    @Override
    public Optional<Alert> resolve(String dedupeKey, Instant at) {
        Alert a = alerts.get(dedupeKey);
        if (a == null) {
            return Optional.empty();
        }
        Alert resolved = new Alert(a.id(), a.yachtId(), a.module(), a.alertType(), a.severity(), a.dedupeKey(),
                a.entityId(), a.assignedTo(), a.dueAt(), a.createdAt(), at);
        alerts.put(dedupeKey, resolved);
        return Optional.of(resolved);
    }

    @Override
    public Optional<Alert> findByDedupeKey(String dedupeKey) {
        return Optional.ofNullable(alerts.get(dedupeKey));
    }
}
