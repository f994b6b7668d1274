package io.notify4j;

import io.notify4j.core.CreateRuleRequest;
import io.notify4j.core.DispatchSummary;
import io.notify4j.core.EventCandidate;
import io.notify4j.core.NotificationRule;
import io.notify4j.core.RuleTestResult;
import io.notify4j.core.TestRuleRequest;
import io.notify4j.core.UpdateRuleRequest;

import java.util.List;

/**
 * Declarative rule API. Business modules hand event candidates to {@link #dispatchCandidates(List)}.
 */
public interface RuleEngine {

    NotificationRule createRule(String actorUserId, CreateRuleRequest request);

    NotificationRule updateRule(String ruleId, UpdateRuleRequest request);

    NotificationRule getRule(String ruleId);

    List<NotificationRule> listRules(String module, String yachtId, Boolean active);

    /**
     * Render and resolve a rule against a sample payload without sending anything.
     */
    RuleTestResult testRule(String ruleId, TestRuleRequest request);

    DispatchSummary dispatchCandidates(List<EventCandidate> candidates);
}
