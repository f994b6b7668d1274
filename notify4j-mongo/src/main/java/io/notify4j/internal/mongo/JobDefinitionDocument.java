package io.notify4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * Mongo document model for job definitions.
 */
@Document(collection = "job_definitions")
public class JobDefinitionDocument {

    @Id
    private String id;

    private String title;
    private String module;
    private String yachtId;
    private String instructionsTemplate;
    private String scheduleType;
    private String cronExpression;
    private Integer everyHours;
    private Integer everyDays;
    private String timezone;
    private String assignmentMode;
    private List<String> assignmentRoles;
    private List<String> assignmentUserIds;
    private List<ReminderEntry> reminders;
    private String status;
    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String createdByUserId;
    private Instant createdAt;
    private Instant updatedAt;

    public JobDefinitionDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getModule() {
        return module;
    }

    public void setModule(String module) {
        this.module = module;
    }

    public String getYachtId() {
        return yachtId;
    }

    public void setYachtId(String yachtId) {
        this.yachtId = yachtId;
    }

    public String getInstructionsTemplate() {
        return instructionsTemplate;
    }

    public void setInstructionsTemplate(String instructionsTemplate) {
        this.instructionsTemplate = instructionsTemplate;
    }

    public String getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(String scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public Integer getEveryHours() {
        return everyHours;
    }

    public void setEveryHours(Integer everyHours) {
        this.everyHours = everyHours;
    }

    public Integer getEveryDays() {
        return everyDays;
    }

    public void setEveryDays(Integer everyDays) {
        this.everyDays = everyDays;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getAssignmentMode() {
        return assignmentMode;
    }

    public void setAssignmentMode(String assignmentMode) {
        this.assignmentMode = assignmentMode;
    }

    public List<String> getAssignmentRoles() {
        return assignmentRoles;
    }

    public void setAssignmentRoles(List<String> assignmentRoles) {
        this.assignmentRoles = assignmentRoles;
    }

    public List<String> getAssignmentUserIds() {
        return assignmentUserIds;
    }

    public void setAssignmentUserIds(List<String> assignmentUserIds) {
        this.assignmentUserIds = assignmentUserIds;
    }

    public List<ReminderEntry> getReminders() {
        return reminders;
    }

    public void setReminders(List<ReminderEntry> reminders) {
        this.reminders = reminders;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
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

    /**
     * Embedded reminder: {@code {offsetHours, channels[]}}.
     */
    public static class ReminderEntry {
        private int offsetHours;
        private List<String> channels;

        public ReminderEntry() {
        }

        public ReminderEntry(int offsetHours, List<String> channels) {
            this.offsetHours = offsetHours;
            this.channels = channels;
        }

        public int getOffsetHours() {
            return offsetHours;
        }

        public void setOffsetHours(int offsetHours) {
            this.offsetHours = offsetHours;
        }

        public List<String> getChannels() {
            return channels;
        }

        public void setChannels(List<String> channels) {
            this.channels = channels;
        }
    }
}
