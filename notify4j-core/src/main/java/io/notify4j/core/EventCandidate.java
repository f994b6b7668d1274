package io.notify4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Ephemeral business event offered to the rule engine. Never persisted on its own.
 */
public record EventCandidate(
        String type,
        String module,
        String yachtId,
        String entityType,
        String entityId,
        Severity severity,
        EventPayload payload,
        String assigneeUserId,
        Instant occurredAt
) {
    public EventCandidate {
        Objects.requireNonNull(type, "type must not be null");
        severity = severity == null ? Severity.INFO : severity;
        payload = payload == null ? EventPayload.empty() : payload;
    }

    public static Builder builder(String type, String module) {
        return new Builder(type, module);
    }

    public static final class Builder {
        private final String type;
        private final String module;
        private String yachtId;
        private String entityType;
        private String entityId;
        private Severity severity = Severity.INFO;
        private EventPayload payload = EventPayload.empty();
        private String assigneeUserId;
        private Instant occurredAt;

        private Builder(String type, String module) {
            this.type = type;
            this.module = module;
        }

        public Builder yachtId(String yachtId) {
            this.yachtId = yachtId;
            return this;
        }

        public Builder entity(String entityType, String entityId) {
            this.entityType = entityType;
            this.entityId = entityId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder payload(Map<String, ?> payload) {
            this.payload = EventPayload.of(payload);
            return this;
        }

        public Builder payload(EventPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder assigneeUserId(String assigneeUserId) {
            this.assigneeUserId = assigneeUserId;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public EventCandidate build() {
            return new EventCandidate(type, module, yachtId, entityType, entityId, severity, payload,
                    assigneeUserId, occurredAt);
        }
    }
}
