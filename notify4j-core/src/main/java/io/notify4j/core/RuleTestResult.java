package io.notify4j.core;

import java.util.List;

/**
 * What a rule would do for a sample candidate. Nothing is sent.
 */
public record RuleTestResult(
        String ruleId,
        Severity severity,
        String renderedTitle,
        String renderedMessage,
        List<String> recipients,
        boolean conditionMatch,
        boolean severityMatch
) {
}
