package io.notify4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.notify4j.core.AssignmentMode;
import io.notify4j.core.AssignmentPolicy;
import io.notify4j.core.DuplicateRunException;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.JobRun;
import io.notify4j.core.JobRunStatus;
import io.notify4j.core.JobSchedule;
import io.notify4j.core.JobStatus;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.ReminderPolicy;
import io.notify4j.core.RunTrigger;
import io.notify4j.core.ScheduleType;
import io.notify4j.spi.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.notify4j.internal.mongo.MongoValues.copy;
import static io.notify4j.internal.mongo.MongoValues.enumValue;
import static io.notify4j.internal.mongo.MongoValues.enumValues;
import static io.notify4j.internal.mongo.MongoValues.plainMap;
import static io.notify4j.internal.mongo.MongoValues.value;
import static io.notify4j.internal.mongo.MongoValues.values;

/**
 * MongoDB persistence for job definitions ({@code job_definitions}) and runs ({@code job_runs}).
 *
 * <p>Run completion and the job advance are written inside one transaction when a
 * {@link TransactionTemplate} is supplied (replica set or sharded cluster required). Without one the two
 * updates are applied back to back.
 */
public class MongoJobStore implements JobStore {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, null);
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, TransactionTemplate transactionTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.transactionTemplate = transactionTemplate;
    }

    /* ================= definitions ================= */

    @Override
    public JobDefinition insert(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        JobDefinitionDocument doc = toDocument(job);
        doc.setId(null);
        return toDefinition(mongoTemplate.insert(doc));
    }

    @Override
    public JobDefinition save(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job.id must not be null");
        if (!mongoTemplate.exists(byId(job.id()), JobDefinitionDocument.class)) {
            throw new NotFoundException("job", job.id());
        }
        return toDefinition(mongoTemplate.save(toDocument(job)));
    }

    @Override
    public Optional<JobDefinition> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDefinitionDocument.class)).map(this::toDefinition);
    }

    @Override
    public List<JobDefinition> find(String yachtId, JobStatus status) {
        Query q = new Query();
        if (yachtId != null) {
            q.addCriteria(Criteria.where("yachtId").is(yachtId));
        }
        if (status != null) {
            q.addCriteria(Criteria.where("status").is(value(status)));
        }
        q.with(Sort.by(Sort.Order.asc("status"), Sort.Order.desc("updatedAt")));
        return toDefinitions(mongoTemplate.find(q, JobDefinitionDocument.class));
    }

    @Override
    public List<JobDefinition> findDue(Instant now, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(Criteria.where("status").is(value(JobStatus.ACTIVE))
                .and("nextRunAt").ne(null).lte(now))
                .with(Sort.by(Sort.Order.asc("nextRunAt")))
                .limit(limit);
        return toDefinitions(mongoTemplate.find(q, JobDefinitionDocument.class));
    }

    @Override
    public List<JobDefinition> findUpcoming(Instant from, Instant to, int limit) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Query q = new Query(Criteria.where("status").is(value(JobStatus.ACTIVE))
                .and("nextRunAt").ne(null).gte(from).lte(to))
                .with(Sort.by(Sort.Order.asc("nextRunAt")))
                .limit(limit);
        return toDefinitions(mongoTemplate.find(q, JobDefinitionDocument.class));
    }

    /* ================= runs ================= */

    @Override
    public JobRun createRun(JobRun run) {
        Objects.requireNonNull(run, "run must not be null");
        Objects.requireNonNull(run.dedupeKey(), "run.dedupeKey must not be null");

        if (mongoTemplate.exists(new Query(Criteria.where("activeDedupeKey").is(run.dedupeKey())), JobRunDocument.class)) {
            throw new DuplicateRunException(run.dedupeKey());
        }

        JobRunDocument doc = toDocument(run);
        doc.setId(null);
        doc.setActiveDedupeKey(run.dedupeKey());
        try {
            return toRun(mongoTemplate.insert(doc));
        } catch (DuplicateKeyException e) {
            // lost the race against another writer holding the unique index
            throw new DuplicateRunException(run.dedupeKey());
        }
    }

    @Override
    public JobRun markRunning(String runId, Instant startedAt) {
        Update u = new Update()
                .set("status", value(JobRunStatus.RUNNING))
                .set("startedAt", startedAt);
        JobRunDocument doc = mongoTemplate.findAndModify(byId(runId), u,
                FindAndModifyOptions.options().returnNew(true), JobRunDocument.class);
        if (doc == null) {
            throw new NotFoundException("job run", runId);
        }
        return toRun(doc);
    }

    @Override
    public JobRun completeRun(String runId, Instant finishedAt, Map<String, Object> summary,
                              String jobId, Instant expectedUpdatedAt, Instant lastRunAt, Instant nextRunAt) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");

        if (transactionTemplate == null) {
            return doCompleteRun(runId, finishedAt, summary, jobId, expectedUpdatedAt, lastRunAt, nextRunAt);
        }
        return transactionTemplate.execute(status ->
                doCompleteRun(runId, finishedAt, summary, jobId, expectedUpdatedAt, lastRunAt, nextRunAt));
    }

    private JobRun doCompleteRun(String runId, Instant finishedAt, Map<String, Object> summary,
                                 String jobId, Instant expectedUpdatedAt, Instant lastRunAt, Instant nextRunAt) {
        Update runUpdate = new Update()
                .set("status", value(JobRunStatus.COMPLETED))
                .set("finishedAt", finishedAt)
                .set("summary", plainMap(objectMapper, summary));
        JobRunDocument run = mongoTemplate.findAndModify(byId(runId), runUpdate,
                FindAndModifyOptions.options().returnNew(true), JobRunDocument.class);
        if (run == null) {
            throw new NotFoundException("job run", runId);
        }

        Query unchanged = new Query(Criteria.where("_id").is(jobId)
                .and("status").is(value(JobStatus.ACTIVE))
                .and("updatedAt").is(expectedUpdatedAt));
        Update advance = new Update()
                .set("lastRunAt", lastRunAt)
                .set("updatedAt", lastRunAt)
                .set("nextRunAt", nextRunAt);
        if (mongoTemplate.updateFirst(unchanged, advance, JobDefinitionDocument.class).getMatchedCount() > 0) {
            return toRun(run);
        }

        // paused or edited during the run: its nextRunAt wins
        UpdateResult r = mongoTemplate.updateFirst(byId(jobId), new Update().set("lastRunAt", lastRunAt),
                JobDefinitionDocument.class);
        if (r.getMatchedCount() == 0) {
            throw new NotFoundException("job", jobId);
        }
        return toRun(run);
    }

    @Override
    public void failRun(String runId, Instant finishedAt, String error) {
        Objects.requireNonNull(runId, "runId must not be null");
        Update u = new Update()
                .set("status", value(JobRunStatus.FAILED))
                .set("finishedAt", finishedAt)
                .set("summary", Map.of("error", error == null ? "unknown_error" : error))
                .unset("activeDedupeKey");
        mongoTemplate.updateFirst(byId(runId), u, JobRunDocument.class);
    }

    @Override
    public List<JobRun> findRuns(String jobId, int limit) {
        Query q = new Query(Criteria.where("jobDefinitionId").is(jobId))
                .with(Sort.by(Sort.Order.desc("scheduledAt")))
                .limit(limit);
        List<JobRunDocument> docs = mongoTemplate.find(q, JobRunDocument.class);
        List<JobRun> runs = new ArrayList<>(docs.size());
        for (JobRunDocument d : docs) {
            runs.add(toRun(d));
        }
        return runs;
    }

    @Override
    public long countRuns(String jobId) {
        return mongoTemplate.count(new Query(Criteria.where("jobDefinitionId").is(jobId)), JobRunDocument.class);
    }

    /* ================= mapping ================= */

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private List<JobDefinition> toDefinitions(List<JobDefinitionDocument> docs) {
        List<JobDefinition> out = new ArrayList<>(docs.size());
        for (JobDefinitionDocument d : docs) {
            out.add(toDefinition(d));
        }
        return out;
    }

    JobDefinitionDocument toDocument(JobDefinition job) {
        JobDefinitionDocument doc = new JobDefinitionDocument();
        doc.setId(job.id());
        doc.setTitle(job.title());
        doc.setModule(job.module());
        doc.setYachtId(job.yachtId());
        doc.setInstructionsTemplate(job.instructionsTemplate());

        JobSchedule s = job.schedule();
        if (s != null) {
            doc.setScheduleType(value(s.type()));
            doc.setCronExpression(s.expression());
            doc.setEveryHours(s.everyHours());
            doc.setEveryDays(s.everyDays());
            doc.setTimezone(s.timezone());
        }

        AssignmentPolicy p = job.assignmentPolicy();
        if (p != null) {
            doc.setAssignmentMode(value(p.mode()));
            doc.setAssignmentRoles(copy(p.roles()));
            doc.setAssignmentUserIds(copy(p.userIds()));
        }

        List<JobDefinitionDocument.ReminderEntry> reminders = new ArrayList<>(job.reminders().size());
        for (ReminderPolicy r : job.reminders()) {
            reminders.add(new JobDefinitionDocument.ReminderEntry(r.offsetHours(), values(r.channels())));
        }
        doc.setReminders(reminders);

        doc.setStatus(value(job.status()));
        doc.setNextRunAt(job.nextRunAt());
        doc.setLastRunAt(job.lastRunAt());
        doc.setCreatedByUserId(job.createdByUserId());
        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(JobDefinition)}. Reminder entries without a valid offset or channel are dropped.
     */
    JobDefinition toDefinition(JobDefinitionDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");

        List<ReminderPolicy> reminders = new ArrayList<>();
        if (doc.getReminders() != null) {
            for (JobDefinitionDocument.ReminderEntry e : doc.getReminders()) {
                List<NotificationChannel> channels = enumValues(NotificationChannel.class, e.getChannels());
                if (e.getOffsetHours() > 0 && !channels.isEmpty()) {
                    reminders.add(new ReminderPolicy(e.getOffsetHours(), channels));
                }
            }
        }

        String timezone = doc.getTimezone() == null || doc.getTimezone().isBlank()
                ? JobSchedule.DEFAULT_TIMEZONE
                : doc.getTimezone();

        return JobDefinition.builder()
                .id(doc.getId())
                .title(doc.getTitle())
                .module(doc.getModule())
                .yachtId(doc.getYachtId())
                .instructionsTemplate(doc.getInstructionsTemplate())
                .schedule(new JobSchedule(enumValue(ScheduleType.class, doc.getScheduleType()), doc.getCronExpression(),
                        doc.getEveryHours(), doc.getEveryDays(), timezone))
                .assignmentPolicy(new AssignmentPolicy(enumValue(AssignmentMode.class, doc.getAssignmentMode()),
                        doc.getAssignmentRoles(), doc.getAssignmentUserIds()))
                .reminders(reminders)
                .status(enumValue(JobStatus.class, doc.getStatus()))
                .nextRunAt(doc.getNextRunAt())
                .lastRunAt(doc.getLastRunAt())
                .createdByUserId(doc.getCreatedByUserId())
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private JobRunDocument toDocument(JobRun run) {
        JobRunDocument doc = new JobRunDocument();
        doc.setId(run.id());
        doc.setJobDefinitionId(run.jobDefinitionId());
        doc.setScheduledAt(run.scheduledAt());
        doc.setStatus(value(run.status()));
        doc.setTrigger(value(run.trigger()));
        doc.setStartedAt(run.startedAt());
        doc.setFinishedAt(run.finishedAt());
        doc.setDedupeKey(run.dedupeKey());
        doc.setSummary(plainMap(objectMapper, run.summary()));
        return doc;
    }

    private JobRun toRun(JobRunDocument doc) {
        return new JobRun(
                doc.getId(),
                doc.getJobDefinitionId(),
                doc.getScheduledAt(),
                enumValue(JobRunStatus.class, doc.getStatus()),
                enumValue(RunTrigger.class, doc.getTrigger()),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getDedupeKey(),
                doc.getSummary()
        );
    }
}
