package io.notify4j.core;

import java.util.Map;

/**
 * Dry-run input for a rule: a sample payload plus the candidate context it would arrive with.
 */
public record TestRuleRequest(
        Map<String, Object> samplePayload,
        String yachtId,
        String entityType,
        String entityId,
        String assigneeUserId
) {
    public TestRuleRequest {
        samplePayload = samplePayload == null ? Map.of() : samplePayload;
    }
}
