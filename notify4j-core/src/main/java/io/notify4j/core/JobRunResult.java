package io.notify4j.core;

/**
 * A completed run together with the job state it advanced to.
 */
public record JobRunResult(JobRun run, JobDefinition job, int delivered) {
}
