package io.notify4j;

import io.notify4j.core.CreateJobRequest;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.JobRunResult;
import io.notify4j.core.JobStatus;
import io.notify4j.core.RunHistory;
import io.notify4j.core.TickResult;
import io.notify4j.core.UpdateJobRequest;

import java.util.List;
import java.util.Map;

/**
 * Recurring job API.
 *
 * <p>A periodic {@link #tick()} executes due jobs and then sends reminders ahead of upcoming runs.
 * Everything is processed one job at a time; a failing job never aborts the rest of the batch.
 */
public interface JobScheduler {

    JobDefinition createJob(String actorUserId, CreateJobRequest request);

    JobDefinition updateJob(String jobId, UpdateJobRequest request);

    JobDefinition getJob(String jobId);

    /**
     * @param yachtId optional yacht filter
     * @param status  optional status filter
     */
    List<JobDefinition> listJobs(String yachtId, JobStatus status);

    /**
     * Execute a job immediately with {@code scheduledAt = now}, regardless of its status.
     */
    JobRunResult runNow(String jobId, String actorUserId, Map<String, Object> payload);

    RunHistory listRuns(String jobId, Integer limit);

    TickResult tick();

    TickResult.DueRuns processDueJobs();

    TickResult.Reminders processReminders();
}
