package io.notify4j.config;

import io.notify4j.internal.mongo.AlertDocument;
import io.notify4j.internal.mongo.JobDefinitionDocument;
import io.notify4j.internal.mongo.JobRunDocument;
import io.notify4j.internal.mongo.NotificationEventDocument;
import io.notify4j.internal.mongo.NotificationRuleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for notify4j.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code notify4j.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due</b> on {@code job_definitions}: { status: 1, nextRunAt: 1 }
 *       <br/>Due-job and reminder-window scans.</li>
 *   <li><b>ux_active_dedupe</b> on {@code job_runs} (unique + sparse): { activeDedupeKey: 1 }
 *       <br/>At most one non-failed run per job and scheduled time.</li>
 *   <li><b>idx_job_scheduled</b> on {@code job_runs}: { jobDefinitionId: 1, scheduledAt: -1 }
 *       <br/>Run history.</li>
 *   <li><b>idx_ledger_dedupe</b> on {@code notification_events}: { userId: 1, channel: 1, dedupeKey: 1, createdAt: -1 }
 *       <br/>Dedupe lookups and in-app listing.</li>
 *   <li><b>ux_alert_dedupe</b> on {@code alerts} (unique): { dedupeKey: 1 }</li>
 *   <li><b>idx_rule_event</b> on {@code notification_rules}: { eventType: 1, active: 1 }
 *       <br/>Rule lookup during candidate dispatch.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.job_definitions.createIndex({ status: 1, nextRunAt: 1 }, { name: "idx_due" });
 * db.job_runs.createIndex({ activeDedupeKey: 1 }, { name: "ux_active_dedupe", unique: true, sparse: true });
 * db.job_runs.createIndex({ jobDefinitionId: 1, scheduledAt: -1 }, { name: "idx_job_scheduled" });
 * db.notification_events.createIndex(
 *   { userId: 1, channel: 1, dedupeKey: 1, createdAt: -1 }, { name: "idx_ledger_dedupe" }
 * );
 * db.alerts.createIndex({ dedupeKey: 1 }, { name: "ux_alert_dedupe", unique: true });
 * db.notification_rules.createIndex({ eventType: 1, active: 1 }, { name: "idx_rule_event" });
 * </pre>
 */
public class Notify4jMongoIndexConfig {

    public static final String IDX_DUE = "idx_due";
    public static final String UX_ACTIVE_DEDUPE = "ux_active_dedupe";
    public static final String IDX_JOB_SCHEDULED = "idx_job_scheduled";
    public static final String IDX_LEDGER_DEDUPE = "idx_ledger_dedupe";
    public static final String UX_ALERT_DEDUPE = "ux_alert_dedupe";
    public static final String IDX_RULE_EVENT = "idx_rule_event";

    private final MongoTemplate mongoTemplate;

    public Notify4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Create all required indexes. Not annotated with {@code @PostConstruct}; call it explicitly
     * or enable {@code notify4j.ensure-indexes-on-startup}.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDefinitionDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(activeDedupeUniqueIndex());
        mongoTemplate.indexOps(JobRunDocument.class).ensureIndex(jobScheduledIndex());
        mongoTemplate.indexOps(NotificationEventDocument.class).ensureIndex(ledgerDedupeIndex());
        mongoTemplate.indexOps(AlertDocument.class).ensureIndex(alertDedupeUniqueIndex());
        mongoTemplate.indexOps(NotificationRuleDocument.class).ensureIndex(ruleEventIndex());
    }

    public static Index dueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    /**
     * Failed runs clear {@code activeDedupeKey}, so the sparse index lets a failed slot be retried.
     */
    public static Index activeDedupeUniqueIndex() {
        return new Index()
                .on("activeDedupeKey", Sort.Direction.ASC)
                .unique()
                .sparse()
                .named(UX_ACTIVE_DEDUPE);
    }

    public static Index jobScheduledIndex() {
        return new Index()
                .on("jobDefinitionId", Sort.Direction.ASC)
                .on("scheduledAt", Sort.Direction.DESC)
                .named(IDX_JOB_SCHEDULED);
    }

    public static Index ledgerDedupeIndex() {
        return new Index()
                .on("userId", Sort.Direction.ASC)
                .on("channel", Sort.Direction.ASC)
                .on("dedupeKey", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.DESC)
                .named(IDX_LEDGER_DEDUPE);
    }

    public static Index alertDedupeUniqueIndex() {
        return new Index()
                .on("dedupeKey", Sort.Direction.ASC)
                .unique()
                .named(UX_ALERT_DEDUPE);
    }

    public static Index ruleEventIndex() {
        return new Index()
                .on("eventType", Sort.Direction.ASC)
                .on("active", Sort.Direction.ASC)
                .named(IDX_RULE_EVENT);
    }
}
