package io.notify4j.core;

import java.util.List;

/**
 * Input of {@code JobScheduler#createJob}. {@code status} defaults to active.
 */
public record CreateJobRequest(
        String title,
        String module,
        String yachtId,
        String instructionsTemplate,
        JobSchedule schedule,
        AssignmentPolicy assignmentPolicy,
        List<ReminderPolicy> reminders,
        JobStatus status
) {
}
