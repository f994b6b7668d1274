package io.notify4j.internal;

import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationRule;
import io.notify4j.spi.RuleStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class InMemoryRuleStore implements RuleStore {
    final Map<String, NotificationRule> rules = new LinkedHashMap<>();
    private int seq;

    @Override
    public NotificationRule insert(NotificationRule rule) {
        NotificationRule saved = rule.toBuilder().id("rule-" + (++seq)).build();
        rules.put(saved.id(), saved);
        return saved;
    }

    @Override
    public NotificationRule save(NotificationRule rule) {
        if (!rules.containsKey(rule.id())) {
            throw new NotFoundException("notification rule", rule.id());
        }
        rules.put(rule.id(), rule);
        return rule;
    }

    @Override
    public Optional<NotificationRule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public List<NotificationRule> find(String module, String yachtId, Boolean active) {
        List<NotificationRule> out = new ArrayList<>();
        for (NotificationRule r : rules.values()) {
            if ((module == null || module.equals(r.module()))
                    && (yachtId == null || yachtId.equals(r.scope().yachtId()))
                    && (active == null || active == r.active())) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparing(NotificationRule::active).reversed()
                .thenComparing(NotificationRule::updatedAt, Comparator.reverseOrder()));
        return out;
    }

    @Override
    public List<NotificationRule> findActiveByEventTypes(Collection<String> eventTypes) {
        List<NotificationRule> out = new ArrayList<>();
        for (NotificationRule r : rules.values()) {
            if (r.active() && eventTypes.contains(r.eventType())) {
                out.add(r);
            }
        }
        return out;
    }

    @Override
    public void markTriggered(String ruleId, Instant at) {
        NotificationRule r = rules.get(ruleId);
        if (r != null) {
            rules.put(ruleId, r.toBuilder().lastTriggeredAt(at).build());
        }
    }
}
