package io.notify4j.core;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a rule; {@code null} fields are left unchanged.
 */
public record UpdateRuleRequest(
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
        Integer dedupeWindowHours,
        Boolean active
) {
    public static UpdateRuleRequest active(boolean active) {
        return new UpdateRuleRequest(null, null, null, null, null, null, null, null, null, null, null, active);
    }
}
