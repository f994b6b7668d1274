package io.notify4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for job runs.
 *
 * <p>{@code activeDedupeKey} mirrors {@code dedupeKey} until the run fails; a unique sparse index on it
 * allows one non-failed run per key.
 */
@Document(collection = "job_runs")
public class JobRunDocument {

    @Id
    private String id;

    private String jobDefinitionId;
    private Instant scheduledAt;
    private String status;
    private String trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private String dedupeKey;
    private String activeDedupeKey;
    private Map<String, Object> summary;

    public JobRunDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getJobDefinitionId() {
        return jobDefinitionId;
    }

    public void setJobDefinitionId(String jobDefinitionId) {
        this.jobDefinitionId = jobDefinitionId;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(Instant scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTrigger() {
        return trigger;
    }

    public void setTrigger(String trigger) {
        this.trigger = trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    public void setDedupeKey(String dedupeKey) {
        this.dedupeKey = dedupeKey;
    }

    public String getActiveDedupeKey() {
        return activeDedupeKey;
    }

    public void setActiveDedupeKey(String activeDedupeKey) {
        this.activeDedupeKey = activeDedupeKey;
    }

    public Map<String, Object> getSummary() {
        return summary;
    }

    public void setSummary(Map<String, Object> summary) {
        this.summary = summary;
    }
}
