package io.notify4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Mongo document model for notification rules.
 *
 * <p>Conditions are kept as a JSON string so dotted payload paths survive as map keys.
 */
@Document(collection = "notification_rules")
public class NotificationRuleDocument {

    @Id
    private String id;

    private String name;
    private String module;
    private String eventType;
    private String scopeType;
    private String yachtId;
    private String entityType;
    private String entityId;
    private String conditionsJson;
    private String cadenceMode;
    private Integer cadenceValue;
    private List<String> channels;
    private String minSeverity;
    private String templateTitle;
    private String templateMessage;
    private String recipientMode;
    private List<String> recipientRoles;
    private List<String> recipientUserIds;
    private List<String> escalationRoles;
    private int dedupeWindowHours;
    private boolean active;
    private Instant lastTriggeredAt;
    private String createdByUserId;
    private Instant createdAt;
    private Instant updatedAt;

    public NotificationRuleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getScopeType() {
        return scopeType;
    }

    public void setScopeType(String scopeType) {
        this.scopeType = scopeType;
    }

    public String getYachtId() {
        return yachtId;
    }

    public void setYachtId(String yachtId) {
        this.yachtId = yachtId;
    }

    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getConditionsJson() {
        return conditionsJson;
    }

    public void setConditionsJson(String conditionsJson) {
        this.conditionsJson = conditionsJson;
    }

    public String getCadenceMode() {
        return cadenceMode;
    }

    public void setCadenceMode(String cadenceMode) {
        this.cadenceMode = cadenceMode;
    }

    public Integer getCadenceValue() {
        return cadenceValue;
    }

    public void setCadenceValue(Integer cadenceValue) {
        this.cadenceValue = cadenceValue;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels;
    }

    public String getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity;
    }

    public String getTemplateTitle() {
        return templateTitle;
    }

    public void setTemplateTitle(String templateTitle) {
        this.templateTitle = templateTitle;
    }

    public String getTemplateMessage() {
        return templateMessage;
    }

    public void setTemplateMessage(String templateMessage) {
        this.templateMessage = templateMessage;
    }

    public String getRecipientMode() {
        return recipientMode;
    }

    public void setRecipientMode(String recipientMode) {
        this.recipientMode = recipientMode;
    }

    public List<String> getRecipientRoles() {
        return recipientRoles;
    }

    public void setRecipientRoles(List<String> recipientRoles) {
        this.recipientRoles = recipientRoles;
    }

    public List<String> getRecipientUserIds() {
        return recipientUserIds;
    }

    public void setRecipientUserIds(List<String> recipientUserIds) {
        this.recipientUserIds = recipientUserIds;
    }

    public List<String> getEscalationRoles() {
        return escalationRoles;
    }

    public void setEscalationRoles(List<String> escalationRoles) {
        this.escalationRoles = escalationRoles;
    }

    public int getDedupeWindowHours() {
        return dedupeWindowHours;
    }

    public void setDedupeWindowHours(int dedupeWindowHours) {
        this.dedupeWindowHours = dedupeWindowHours;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getLastTriggeredAt() {
        return lastTriggeredAt;
    }

    public void setLastTriggeredAt(Instant lastTriggeredAt) {
        this.lastTriggeredAt = lastTriggeredAt;
    }

    public String getCreatedByUserId() {
        return createdByUserId;
    }

    public void setCreatedByUserId(String createdByUserId) {
        this.createdByUserId = createdByUserId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
