package io.notify4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * One execution of a {@link JobDefinition}. Immutable once {@code finishedAt} is set.
 */
public record JobRun(
        String id,
        String jobDefinitionId,
        Instant scheduledAt,
        JobRunStatus status,
        RunTrigger trigger,
        Instant startedAt,
        Instant finishedAt,
        String dedupeKey,
        Map<String, Object> summary
) {
    public JobRun {
        summary = summary == null ? Map.of() : summary;
    }

    public static JobRun pending(String jobDefinitionId, Instant scheduledAt, RunTrigger trigger, String dedupeKey) {
        return new JobRun(null, jobDefinitionId, scheduledAt, JobRunStatus.PENDING, trigger, null, null, dedupeKey, Map.of());
    }
}
