package io.notify4j.core;

import java.time.Instant;
import java.util.List;

/**
 * A recurring unit of work.
 *
 * <p>Invariant: {@code nextRunAt} is null iff {@code status} is not {@link JobStatus#ACTIVE}.
 */
public record JobDefinition(

        // identity
        String id,
        String title,
        String module,
        String yachtId,

        // work
        String instructionsTemplate,
        JobSchedule schedule,
        AssignmentPolicy assignmentPolicy,
        List<ReminderPolicy> reminders,

        // state
        JobStatus status,
        Instant nextRunAt,
        Instant lastRunAt,

        // audit
        String createdByUserId,
        Instant createdAt,
        Instant updatedAt
) {
    public JobDefinition {
        reminders = reminders == null ? List.of() : List.copyOf(reminders);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .module(module)
                .yachtId(yachtId)
                .instructionsTemplate(instructionsTemplate)
                .schedule(schedule)
                .assignmentPolicy(assignmentPolicy)
                .reminders(reminders)
                .status(status)
                .nextRunAt(nextRunAt)
                .lastRunAt(lastRunAt)
                .createdByUserId(createdByUserId)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String module;
        private String yachtId;
        private String instructionsTemplate;
        private JobSchedule schedule;
        private AssignmentPolicy assignmentPolicy;
        private List<ReminderPolicy> reminders = List.of();
        private JobStatus status = JobStatus.ACTIVE;
        private Instant nextRunAt;
        private Instant lastRunAt;
        private String createdByUserId;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder yachtId(String yachtId) {
            this.yachtId = yachtId;
            return this;
        }

        public Builder instructionsTemplate(String instructionsTemplate) {
            this.instructionsTemplate = instructionsTemplate;
            return this;
        }

        public Builder schedule(JobSchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder assignmentPolicy(AssignmentPolicy assignmentPolicy) {
            this.assignmentPolicy = assignmentPolicy;
            return this;
        }

        public Builder reminders(List<ReminderPolicy> reminders) {
            this.reminders = reminders;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder createdByUserId(String createdByUserId) {
            this.createdByUserId = createdByUserId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(id, title, module, yachtId, instructionsTemplate, schedule,
                    assignmentPolicy, reminders, status, nextRunAt, lastRunAt, createdByUserId, createdAt, updatedAt);
        }
    }
}
