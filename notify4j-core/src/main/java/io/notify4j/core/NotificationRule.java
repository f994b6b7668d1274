package io.notify4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A declarative matcher between event candidates and notifications.
 *
 * <p>Rules are soft-disabled through {@code active=false}; they are never hard-deleted.
 */
public record NotificationRule(
        String id,
        String name,
        String module,
        String eventType,
        RuleScope scope,
        Map<String, Object> conditions,
        CadencePolicy cadence,
        List<NotificationChannel> channels,
        Severity minSeverity,
        MessageTemplate template,
        RecipientPolicy recipientPolicy,
        int dedupeWindowHours,
        boolean active,
        Instant lastTriggeredAt,
        String createdByUserId,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_DEDUPE_WINDOW_HOURS = 24;

    public NotificationRule {
        conditions = conditions == null ? Map.of() : conditions;
        channels = channels == null ? List.of() : List.copyOf(channels);
        minSeverity = minSeverity == null ? Severity.INFO : minSeverity;
        cadence = cadence == null ? CadencePolicy.daily() : cadence;
        scope = scope == null ? RuleScope.fleet() : scope;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .module(module)
                .eventType(eventType)
                .scope(scope)
                .conditions(conditions)
                .cadence(cadence)
                .channels(channels)
                .minSeverity(minSeverity)
                .template(template)
                .recipientPolicy(recipientPolicy)
                .dedupeWindowHours(dedupeWindowHours)
                .active(active)
                .lastTriggeredAt(lastTriggeredAt)
                .createdByUserId(createdByUserId)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String module;
        private String eventType;
        private RuleScope scope = RuleScope.fleet();
        private Map<String, Object> conditions = Map.of();
        private CadencePolicy cadence = CadencePolicy.daily();
        private List<NotificationChannel> channels = List.of();
        private Severity minSeverity = Severity.INFO;
        private MessageTemplate template;
        private RecipientPolicy recipientPolicy;
        private int dedupeWindowHours = DEFAULT_DEDUPE_WINDOW_HOURS;
        private boolean active = true;
        private Instant lastTriggeredAt;
        private String createdByUserId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder scope(RuleScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder conditions(Map<String, Object> conditions) {
            this.conditions = conditions;
            return this;
        }

        public Builder cadence(CadencePolicy cadence) {
            this.cadence = cadence;
            return this;
        }

        public Builder channels(List<NotificationChannel> channels) {
            this.channels = channels;
            return this;
        }

        public Builder minSeverity(Severity minSeverity) {
            this.minSeverity = minSeverity;
            return this;
        }

        public Builder template(MessageTemplate template) {
            this.template = template;
            return this;
        }

        public Builder recipientPolicy(RecipientPolicy recipientPolicy) {
            this.recipientPolicy = recipientPolicy;
            return this;
        }

        public Builder dedupeWindowHours(int dedupeWindowHours) {
            this.dedupeWindowHours = dedupeWindowHours;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder lastTriggeredAt(Instant lastTriggeredAt) {
            this.lastTriggeredAt = lastTriggeredAt;
            return this;
        }

        public Builder createdByUserId(String createdByUserId) {
            this.createdByUserId = createdByUserId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public NotificationRule build() {
            return new NotificationRule(id, name, module, eventType, scope, conditions, cadence, channels,
                    minSeverity, template, recipientPolicy, dedupeWindowHours, active, lastTriggeredAt,
                    createdByUserId, createdAt, updatedAt);
        }
    }
}
