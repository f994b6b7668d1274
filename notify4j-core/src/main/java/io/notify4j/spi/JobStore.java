package io.notify4j.spi;

import io.notify4j.core.DuplicateRunException;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.JobRun;
import io.notify4j.core.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for job definitions and their runs.
 *
 * <p>Runs move through PENDING → RUNNING → COMPLETED or FAILED. At most one non-failed run may exist
 * per run dedupe key; a failed run releases the key so the same slot can be retried.
 */
public interface JobStore {

    /**
     * Persists a new definition and returns it with its generated id.
     */
    JobDefinition insert(JobDefinition job);

    /**
     * Replaces an existing definition.
     *
     * @throws io.notify4j.core.NotFoundException if no definition has the job's id
     */
    JobDefinition save(JobDefinition job);

    Optional<JobDefinition> findById(String jobId);

    /**
     * @param yachtId optional filter ({@code null} for all)
     * @param status  optional filter ({@code null} for all)
     * @return matching definitions ordered by status, then most recently updated first
     */
    List<JobDefinition> find(String yachtId, JobStatus status);

    /**
     * Active definitions with {@code nextRunAt <= now}, earliest first.
     */
    List<JobDefinition> findDue(Instant now, int limit);

    /**
     * Active definitions with {@code from <= nextRunAt <= to}, earliest first.
     */
    List<JobDefinition> findUpcoming(Instant from, Instant to, int limit);

    /**
     * Inserts a pending run.
     *
     * @throws DuplicateRunException if a non-failed run already holds the run's dedupe key
     */
    JobRun createRun(JobRun run);

    JobRun markRunning(String runId, Instant startedAt);

    /**
     * Completes the run and records {@code lastRunAt} on the job in one atomic write.
     *
     * <p>{@code nextRunAt} is only written when the job is still active and its {@code updatedAt} equals
     * {@code expectedUpdatedAt}, the value read before the run started. A job paused or edited while the
     * run was in flight keeps the {@code nextRunAt} that edit produced.
     *
     * @return the completed run
     * @throws io.notify4j.core.NotFoundException if the run or the job does not exist
     */
    JobRun completeRun(String runId, Instant finishedAt, Map<String, Object> summary,
                       String jobId, Instant expectedUpdatedAt, Instant lastRunAt, Instant nextRunAt);

    /**
     * Marks the run failed with the given error. The job definition is not touched.
     */
    void failRun(String runId, Instant finishedAt, String error);

    /**
     * @return runs of the job, newest {@code scheduledAt} first
     */
    List<JobRun> findRuns(String jobId, int limit);

    long countRuns(String jobId);
}
