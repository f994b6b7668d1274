package io.notify4j.spi;

import io.notify4j.core.NotificationRule;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for notification rules. Rules are never hard-deleted.
 */
public interface RuleStore {

    NotificationRule insert(NotificationRule rule);

    NotificationRule save(NotificationRule rule);

    Optional<NotificationRule> findById(String ruleId);

    /**
     * All filters are optional. Active rules first, then most recently updated.
     *
     * <p>The yacht filter is an exact match on the scope's yacht id.
     */
    List<NotificationRule> find(String module, String yachtId, Boolean active);

    List<NotificationRule> findActiveByEventTypes(Collection<String> eventTypes);

    void markTriggered(String ruleId, Instant at);
}
