package io.notify4j.core;

import java.util.List;

/**
 * Partial update of a job definition; {@code null} fields are left unchanged.
 *
 * <p>{@code yachtId} cannot be cleared through this request, only replaced.
 */
public record UpdateJobRequest(
        String title,
        String module,
        String yachtId,
        String instructionsTemplate,
        JobSchedule schedule,
        AssignmentPolicy assignmentPolicy,
        List<ReminderPolicy> reminders,
        JobStatus status
) {
    public static UpdateJobRequest status(JobStatus status) {
        return new UpdateJobRequest(null, null, null, null, null, null, null, status);
    }

    public static UpdateJobRequest schedule(JobSchedule schedule) {
        return new UpdateJobRequest(null, null, null, null, schedule, null, null, null);
    }
}
