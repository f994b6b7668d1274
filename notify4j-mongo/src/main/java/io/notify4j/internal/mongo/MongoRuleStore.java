package io.notify4j.internal.mongo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.core.CadenceMode;
import io.notify4j.core.CadencePolicy;
import io.notify4j.core.MessageTemplate;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRule;
import io.notify4j.core.RecipientMode;
import io.notify4j.core.RecipientPolicy;
import io.notify4j.core.RuleScope;
import io.notify4j.core.ScopeType;
import io.notify4j.core.Severity;
import io.notify4j.core.ValidationException;
import io.notify4j.spi.RuleStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.notify4j.internal.mongo.MongoValues.copy;
import static io.notify4j.internal.mongo.MongoValues.enumValue;
import static io.notify4j.internal.mongo.MongoValues.enumValues;
import static io.notify4j.internal.mongo.MongoValues.value;
import static io.notify4j.internal.mongo.MongoValues.values;

/**
 * MongoDB persistence for notification rules ({@code notification_rules}).
 */
public class MongoRuleStore implements RuleStore {

    private static final TypeReference<LinkedHashMap<String, Object>> CONDITIONS_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoRuleStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public NotificationRule insert(NotificationRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        NotificationRuleDocument doc = toDocument(rule);
        doc.setId(null);
        return toRule(mongoTemplate.insert(doc));
    }

    @Override
    public NotificationRule save(NotificationRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(rule.id(), "rule.id must not be null");
        if (!mongoTemplate.exists(byId(rule.id()), NotificationRuleDocument.class)) {
            throw new NotFoundException("notification rule", rule.id());
        }
        return toRule(mongoTemplate.save(toDocument(rule)));
    }

    @Override
    public Optional<NotificationRule> findById(String ruleId) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(ruleId, NotificationRuleDocument.class)).map(this::toRule);
    }

    @Override
    public List<NotificationRule> find(String module, String yachtId, Boolean active) {
        Query q = new Query();
        if (module != null) {
            q.addCriteria(Criteria.where("module").is(module));
        }
        if (yachtId != null) {
            q.addCriteria(Criteria.where("yachtId").is(yachtId));
        }
        if (active != null) {
            q.addCriteria(Criteria.where("active").is(active));
        }
        q.with(Sort.by(Sort.Order.desc("active"), Sort.Order.desc("updatedAt")));
        return toRules(mongoTemplate.find(q, NotificationRuleDocument.class));
    }

    @Override
    public List<NotificationRule> findActiveByEventTypes(Collection<String> eventTypes) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return List.of();
        }
        Query q = new Query(Criteria.where("active").is(true).and("eventType").in(eventTypes))
                .with(Sort.by(Sort.Order.desc("updatedAt")));
        return toRules(mongoTemplate.find(q, NotificationRuleDocument.class));
    }

    @Override
    public void markTriggered(String ruleId, Instant at) {
        mongoTemplate.updateFirst(byId(ruleId), new Update().set("lastTriggeredAt", at), NotificationRuleDocument.class);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private List<NotificationRule> toRules(List<NotificationRuleDocument> docs) {
        List<NotificationRule> out = new ArrayList<>(docs.size());
        for (NotificationRuleDocument d : docs) {
            out.add(toRule(d));
        }
        return out;
    }

    NotificationRuleDocument toDocument(NotificationRule rule) {
        NotificationRuleDocument doc = new NotificationRuleDocument();
        doc.setId(rule.id());
        doc.setName(rule.name());
        doc.setModule(rule.module());
        doc.setEventType(rule.eventType());

        RuleScope scope = rule.scope();
        doc.setScopeType(value(scope.type()));
        doc.setYachtId(scope.yachtId());
        doc.setEntityType(scope.entityType());
        doc.setEntityId(scope.entityId());

        doc.setConditionsJson(writeConditions(rule.conditions()));
        doc.setCadenceMode(value(rule.cadence().mode()));
        doc.setCadenceValue(rule.cadence().value());
        doc.setChannels(values(rule.channels()));
        doc.setMinSeverity(rule.minSeverity().value());

        if (rule.template() != null) {
            doc.setTemplateTitle(rule.template().title());
            doc.setTemplateMessage(rule.template().message());
        }

        RecipientPolicy p = rule.recipientPolicy();
        if (p != null) {
            doc.setRecipientMode(value(p.mode()));
            doc.setRecipientRoles(copy(p.roles()));
            doc.setRecipientUserIds(copy(p.userIds()));
            doc.setEscalationRoles(copy(p.escalationRoles()));
        }

        doc.setDedupeWindowHours(rule.dedupeWindowHours());
        doc.setActive(rule.active());
        doc.setLastTriggeredAt(rule.lastTriggeredAt());
        doc.setCreatedByUserId(rule.createdByUserId());
        doc.setCreatedAt(rule.createdAt());
        doc.setUpdatedAt(rule.updatedAt());
        return doc;
    }

    NotificationRule toRule(NotificationRuleDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        return NotificationRule.builder()
                .id(doc.getId())
                .name(doc.getName())
                .module(doc.getModule())
                .eventType(doc.getEventType())
                .scope(new RuleScope(enumValue(ScopeType.class, doc.getScopeType()), doc.getYachtId(),
                        doc.getEntityType(), doc.getEntityId()))
                .conditions(readConditions(doc.getConditionsJson()))
                .cadence(new CadencePolicy(enumValue(CadenceMode.class, doc.getCadenceMode()), doc.getCadenceValue()))
                .channels(enumValues(NotificationChannel.class, doc.getChannels()))
                .minSeverity(Severity.normalize(doc.getMinSeverity()))
                .template(new MessageTemplate(doc.getTemplateTitle(), doc.getTemplateMessage()))
                .recipientPolicy(new RecipientPolicy(enumValue(RecipientMode.class, doc.getRecipientMode()),
                        doc.getRecipientRoles(), doc.getRecipientUserIds(), doc.getEscalationRoles()))
                .dedupeWindowHours(doc.getDedupeWindowHours())
                .active(doc.isActive())
                .lastTriggeredAt(doc.getLastTriggeredAt())
                .createdByUserId(doc.getCreatedByUserId())
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private String writeConditions(Map<String, Object> conditions) {
        try {
            return objectMapper.writeValueAsString(conditions == null ? Map.of() : conditions);
        } catch (JsonProcessingException e) {
            throw new ValidationException("conditions are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readConditions(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, CONDITIONS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored rule conditions are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
