package io.notify4j.core;

import java.util.List;
import java.util.Map;

/**
 * Input of {@code RuleEngine#createRule}.
 *
 * <p>Defaults: conditions {@code {}}, cadence daily, minSeverity info, dedupeWindowHours 24, active true.
 */
public record CreateRuleRequest(
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
}
