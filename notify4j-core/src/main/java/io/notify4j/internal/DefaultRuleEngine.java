package io.notify4j.internal;

import io.notify4j.NotificationDispatcher;
import io.notify4j.RuleEngine;
import io.notify4j.core.AlertUpsert;
import io.notify4j.core.CreateRuleRequest;
import io.notify4j.core.DispatchSummary;
import io.notify4j.core.EventCandidate;
import io.notify4j.core.EventPayload;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationRequest;
import io.notify4j.core.NotificationRule;
import io.notify4j.core.RuleScope;
import io.notify4j.core.RuleTestResult;
import io.notify4j.core.Severity;
import io.notify4j.core.TestRuleRequest;
import io.notify4j.core.UpdateRuleRequest;
import io.notify4j.spi.AlertStore;
import io.notify4j.spi.RuleStore;
import io.notify4j.utils.ConditionMatcher;
import io.notify4j.utils.TemplateRenderer;
import io.notify4j.utils.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.notify4j.internal.DefinitionValidator.normalizeCadence;
import static io.notify4j.internal.DefinitionValidator.normalizeChannels;
import static io.notify4j.internal.DefinitionValidator.normalizeDedupeWindow;
import static io.notify4j.internal.DefinitionValidator.normalizeScope;
import static io.notify4j.internal.DefinitionValidator.normalizeTemplate;
import static io.notify4j.internal.DefinitionValidator.require;
import static io.notify4j.internal.DefinitionValidator.requireText;

/**
 * Matches event candidates against stored rules and dispatches the rendered notifications.
 *
 * <p>For every candidate, each active rule of the same event type whose scope matches is one processed pair.
 * A pair goes on to dispatch only when its conditions match, the severity clears the rule threshold and
 * at least one recipient resolves. A failing pair is logged and does not affect the others.
 */
public class DefaultRuleEngine implements RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultRuleEngine.class);

    private final RuleStore rules;
    private final AlertStore alerts;
    private final NotificationDispatcher dispatcher;
    private final RecipientResolver recipients;
    private final TemplateRenderer renderer;
    private final Clock clock;

    public DefaultRuleEngine(
            RuleStore rules,
            AlertStore alerts,
            NotificationDispatcher dispatcher,
            RecipientResolver recipients,
            TemplateRenderer renderer,
            Clock clock
    ) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.alerts = alerts;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.recipients = Objects.requireNonNull(recipients, "recipients must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ================= CRUD ================= */

    @Override
    public NotificationRule createRule(String actorUserId, CreateRuleRequest request) {
        require(request, "request");
        Instant now = now();

        NotificationRule rule = NotificationRule.builder()
                .name(requireText(request.name(), "name"))
                .module(requireText(request.module(), "module"))
                .eventType(requireText(request.eventType(), "eventType"))
                .scope(normalizeScope(request.scope()))
                .conditions(request.conditions() == null ? Map.of() : request.conditions())
                .cadence(normalizeCadence(request.cadence()))
                .channels(normalizeChannels(request.channels(), "channels"))
                .minSeverity(request.minSeverity() == null ? Severity.INFO : request.minSeverity())
                .template(normalizeTemplate(request.template()))
                .recipientPolicy(require(request.recipientPolicy(), "recipientPolicy"))
                .dedupeWindowHours(normalizeDedupeWindow(request.dedupeWindowHours(),
                        NotificationRule.DEFAULT_DEDUPE_WINDOW_HOURS))
                .active(request.active() == null || request.active())
                .createdByUserId(actorUserId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        NotificationRule saved = rules.insert(rule);
        log.info("notify4j rule created ruleId={} eventType={} channels={}", saved.id(), saved.eventType(),
                saved.channels());
        return saved;
    }

    @Override
    public NotificationRule updateRule(String ruleId, UpdateRuleRequest request) {
        require(request, "request");
        NotificationRule existing = getRule(ruleId);
        NotificationRule.Builder b = existing.toBuilder();

        if (request.name() != null) b.name(requireText(request.name(), "name"));
        if (request.module() != null) b.module(requireText(request.module(), "module"));
        if (request.eventType() != null) b.eventType(requireText(request.eventType(), "eventType"));
        if (request.scope() != null) b.scope(normalizeScope(request.scope()));
        if (request.conditions() != null) b.conditions(request.conditions());
        if (request.cadence() != null) b.cadence(normalizeCadence(request.cadence()));
        if (request.channels() != null) b.channels(normalizeChannels(request.channels(), "channels"));
        if (request.minSeverity() != null) b.minSeverity(request.minSeverity());
        if (request.template() != null) b.template(normalizeTemplate(request.template()));
        if (request.recipientPolicy() != null) b.recipientPolicy(request.recipientPolicy());
        if (request.dedupeWindowHours() != null) {
            b.dedupeWindowHours(normalizeDedupeWindow(request.dedupeWindowHours(), existing.dedupeWindowHours()));
        }
        if (request.active() != null) b.active(request.active());

        NotificationRule saved = rules.save(b.updatedAt(now()).build());
        log.info("notify4j rule updated ruleId={} active={}", saved.id(), saved.active());
        return saved;
    }

    @Override
    public NotificationRule getRule(String ruleId) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        return rules.findById(ruleId).orElseThrow(() -> new NotFoundException("notification rule", ruleId));
    }

    @Override
    public List<NotificationRule> listRules(String module, String yachtId, Boolean active) {
        return rules.find(module, yachtId, active);
    }

    /* ================= dry run ================= */

    @Override
    public RuleTestResult testRule(String ruleId, TestRuleRequest request) {
        NotificationRule rule = getRule(ruleId);
        TestRuleRequest req = request == null ? new TestRuleRequest(null, null, null, null, null) : request;
        RuleScope scope = rule.scope();

        Severity severity = EventPayload.of(req.samplePayload()).readOptionalString("severity")
                .map(Severity::normalize)
                .orElse(rule.minSeverity());

        EventCandidate candidate = EventCandidate.builder(rule.eventType(), rule.module())
                .yachtId(req.yachtId() != null ? req.yachtId() : scope.yachtId())
                .entity(req.entityType() != null ? req.entityType() : scope.entityType(),
                        req.entityId() != null ? req.entityId() : scope.entityId())
                .severity(severity)
                .payload(req.samplePayload())
                .assigneeUserId(req.assigneeUserId())
                .occurredAt(now())
                .build();

        List<String> resolved = recipients.resolveRecipients(rule.recipientPolicy(), candidate);
        Map<String, Object> variables = templateVariables(candidate);

        return new RuleTestResult(
                rule.id(),
                severity,
                renderer.render(rule.template().title(), variables),
                renderer.render(rule.template().message(), variables),
                resolved,
                ConditionMatcher.matches(rule.conditions(), candidate.payload()),
                severity.isAtLeast(rule.minSeverity())
        );
    }

    /* ================= dispatch ================= */

    @Override
    public DispatchSummary dispatchCandidates(List<EventCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return DispatchSummary.empty();
        }

        Set<String> eventTypes = new LinkedHashSet<>();
        for (EventCandidate c : candidates) {
            eventTypes.add(c.type());
        }
        List<NotificationRule> activeRules = rules.findActiveByEventTypes(eventTypes);

        int processed = 0;
        int dispatched = 0;

        for (EventCandidate candidate : candidates) {
            for (NotificationRule rule : activeRules) {
                if (!rule.eventType().equals(candidate.type()) || !rule.scope().matches(candidate)) {
                    continue;
                }
                processed++;
                try {
                    dispatched += dispatchRule(rule, candidate);
                } catch (RuntimeException e) {
                    log.warn("notify4j rule dispatch failed ruleId={} eventType={} entityId={} msg={}",
                            rule.id(), candidate.type(), candidate.entityId(), e.getMessage(), e);
                }
            }
        }

        if (processed > 0) {
            log.debug("notify4j candidates dispatched candidates={} processed={} dispatched={}",
                    candidates.size(), processed, dispatched);
        }
        return new DispatchSummary(processed, dispatched);
    }

    private int dispatchRule(NotificationRule rule, EventCandidate candidate) {
        if (!ConditionMatcher.matches(rule.conditions(), candidate.payload())) {
            log.debug("notify4j rule skipped reason=conditions ruleId={} eventType={}", rule.id(), candidate.type());
            return 0;
        }
        if (!candidate.severity().isAtLeast(rule.minSeverity())) {
            log.debug("notify4j rule skipped reason=severity ruleId={} severity={} minSeverity={}",
                    rule.id(), candidate.severity().value(), rule.minSeverity().value());
            return 0;
        }

        List<String> recipientIds = recipients.resolveRecipients(rule.recipientPolicy(), candidate);
        if (recipientIds.isEmpty()) {
            log.debug("notify4j rule skipped reason=no_recipients ruleId={}", rule.id());
            return 0;
        }

        Instant now = now();
        Instant occurredAt = candidate.occurredAt() == null ? now : candidate.occurredAt();
        Map<String, Object> variables = templateVariables(candidate, occurredAt);
        String title = renderer.render(rule.template().title(), variables);
        String message = renderer.render(rule.template().message(), variables);

        Map<String, Object> payload = new LinkedHashMap<>(candidate.payload().asMap());
        payload.put("title", title);
        payload.put("message", message);
        payload.put("module", rule.module());
        payload.put("eventType", candidate.type());

        String baseKey = dedupeKey(rule, candidate);
        int sent = dispatcher.dispatchToRecipients(recipientIds, rule.channels(), userId -> new NotificationRequest(
                userId,
                candidate.yachtId(),
                candidate.type(),
                baseKey + ":user:" + userId,
                candidate.severity(),
                payload,
                rule.dedupeWindowHours()
        ));
        if (sent == 0) {
            return 0;
        }

        rules.markTriggered(rule.id(), now);

        if (alerts != null && candidate.yachtId() != null && candidate.severity().isAtLeast(Severity.WARN)) {
            alerts.upsert(new AlertUpsert(
                    candidate.yachtId(),
                    rule.module(),
                    candidate.type(),
                    candidate.severity(),
                    "rule-alert:" + baseKey,
                    candidate.entityId(),
                    recipientIds.get(0),
                    occurredAt
            ), now);
        }
        return sent;
    }

    /**
     * {@code rule:{ruleId}:event:{type}:scope:{entityId|yachtId|fleet}:bucket:{bucket|default}}
     */
    static String dedupeKey(NotificationRule rule, EventCandidate candidate) {
        String scope = candidate.entityId() != null
                ? candidate.entityId()
                : candidate.yachtId() != null ? candidate.yachtId() : "fleet";
        return "rule:" + rule.id()
                + ":event:" + candidate.type()
                + ":scope:" + scope
                + ":bucket:" + candidate.payload().bucket();
    }

    private Map<String, Object> templateVariables(EventCandidate candidate) {
        Instant occurredAt = candidate.occurredAt() == null ? now() : candidate.occurredAt();
        return templateVariables(candidate, occurredAt);
    }

    private static Map<String, Object> templateVariables(EventCandidate candidate, Instant occurredAt) {
        Map<String, Object> vars = new LinkedHashMap<>(candidate.payload().asMap());
        vars.put("yachtId", candidate.yachtId() == null ? "" : candidate.yachtId());
        vars.put("entityType", candidate.entityType() == null ? "" : candidate.entityType());
        vars.put("entityId", candidate.entityId() == null ? "" : candidate.entityId());
        vars.put("severity", candidate.severity().value());
        vars.put("occurredAt", TimeFormats.iso(occurredAt));
        return vars;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
