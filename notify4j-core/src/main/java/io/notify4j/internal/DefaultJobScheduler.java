package io.notify4j.internal;

import io.notify4j.JobScheduler;
import io.notify4j.NotificationDispatcher;
import io.notify4j.RuleEngine;
import io.notify4j.core.CreateJobRequest;
import io.notify4j.core.DuplicateRunException;
import io.notify4j.core.EventCandidate;
import io.notify4j.core.EventPayload;
import io.notify4j.core.EventTypes;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.JobRun;
import io.notify4j.core.JobRunResult;
import io.notify4j.core.JobSchedule;
import io.notify4j.core.JobStatus;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRequest;
import io.notify4j.core.ReminderPolicy;
import io.notify4j.core.RunHistory;
import io.notify4j.core.RunTrigger;
import io.notify4j.core.SchedulerOptions;
import io.notify4j.core.Severity;
import io.notify4j.core.TickResult;
import io.notify4j.core.UpdateJobRequest;
import io.notify4j.spi.JobStore;
import io.notify4j.utils.ScheduleCalculator;
import io.notify4j.utils.TemplateRenderer;
import io.notify4j.utils.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.notify4j.internal.DefinitionValidator.normalizeReminders;
import static io.notify4j.internal.DefinitionValidator.require;
import static io.notify4j.internal.DefinitionValidator.requireText;
import static io.notify4j.internal.DefinitionValidator.trimToNull;

/**
 * Default {@link JobScheduler}.
 *
 * <p>A run goes PENDING → RUNNING → COMPLETED, with the run completion and the job's
 * {@code lastRunAt}/{@code nextRunAt} advance written atomically by the store. Any failure before
 * that marks the run FAILED, leaves {@code nextRunAt} untouched and rethrows.
 */
public class DefaultJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    public static final String MODULE = "jobs";
    public static final String ENTITY_TYPE = "JobDefinition";

    private static final int DEFAULT_RUNS_LIMIT = 20;
    private static final int MAX_RUNS_LIMIT = 200;

    private final JobStore store;
    private final NotificationDispatcher dispatcher;
    private final RuleEngine ruleEngine;
    private final RecipientResolver recipients;
    private final TemplateRenderer renderer;
    private final SchedulerOptions options;
    private final Clock clock;

    public DefaultJobScheduler(
            JobStore store,
            NotificationDispatcher dispatcher,
            RuleEngine ruleEngine,
            RecipientResolver recipients,
            TemplateRenderer renderer,
            SchedulerOptions options,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
        this.recipients = Objects.requireNonNull(recipients, "recipients must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.options = options == null ? SchedulerOptions.defaults() : options;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ================= definitions ================= */

    @Override
    public JobDefinition createJob(String actorUserId, CreateJobRequest request) {
        require(request, "request");
        JobSchedule schedule = ScheduleCalculator.normalize(request.schedule());
        List<ReminderPolicy> reminders = normalizeReminders(request.reminders());
        JobStatus status = request.status() == null ? JobStatus.ACTIVE : request.status();
        Instant now = now();

        JobDefinition job = JobDefinition.builder()
                .title(requireText(request.title(), "title"))
                .module(requireText(request.module(), "module"))
                .yachtId(trimToNull(request.yachtId()))
                .instructionsTemplate(requireText(request.instructionsTemplate(), "instructionsTemplate"))
                .schedule(schedule)
                .assignmentPolicy(require(request.assignmentPolicy(), "assignmentPolicy"))
                .reminders(reminders)
                .status(status)
                .nextRunAt(status.isSchedulable() ? ScheduleCalculator.computeNextRunAt(schedule, now) : null)
                .createdByUserId(actorUserId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        JobDefinition created = store.insert(job);
        log.info("notify4j job created jobId={} title={} schedule={} nextRunAt={}",
                created.id(), created.title(), schedule.type().value(), created.nextRunAt());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobDefinitionId", created.id());
        payload.put("title", created.title());
        payload.put("module", created.module());
        payload.put("nextRunAt", TimeFormats.iso(created.nextRunAt()));
        emit(jobCandidate(EventTypes.JOBS_CREATED, created, Severity.INFO, payload, now));
        return created;
    }

    @Override
    public JobDefinition updateJob(String jobId, UpdateJobRequest request) {
        require(request, "request");
        JobDefinition existing = getJob(jobId);

        JobSchedule schedule = request.schedule() == null
                ? existing.schedule()
                : ScheduleCalculator.normalize(request.schedule());
        boolean scheduleChanged = !schedule.equals(existing.schedule());
        JobStatus status = request.status() == null ? existing.status() : request.status();
        Instant now = now();

        Instant nextRunAt;
        if (!status.isSchedulable()) {
            nextRunAt = null;
        } else if (scheduleChanged || existing.nextRunAt() == null) {
            nextRunAt = ScheduleCalculator.computeNextRunAt(schedule, now);
        } else {
            nextRunAt = existing.nextRunAt();
        }

        JobDefinition.Builder b = existing.toBuilder()
                .schedule(schedule)
                .status(status)
                .nextRunAt(nextRunAt)
                .updatedAt(now);
        if (request.title() != null) b.title(requireText(request.title(), "title"));
        if (request.module() != null) b.module(requireText(request.module(), "module"));
        if (request.yachtId() != null) b.yachtId(trimToNull(request.yachtId()));
        if (request.instructionsTemplate() != null) {
            b.instructionsTemplate(requireText(request.instructionsTemplate(), "instructionsTemplate"));
        }
        if (request.assignmentPolicy() != null) b.assignmentPolicy(request.assignmentPolicy());
        if (request.reminders() != null) b.reminders(normalizeReminders(request.reminders()));

        JobDefinition updated = store.save(b.build());
        log.info("notify4j job updated jobId={} status={} nextRunAt={}", updated.id(), updated.status().value(),
                updated.nextRunAt());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobDefinitionId", updated.id());
        payload.put("title", updated.title());
        payload.put("status", updated.status().value());
        payload.put("nextRunAt", TimeFormats.iso(updated.nextRunAt()));
        emit(jobCandidate(EventTypes.JOBS_ASSIGNMENT_CHANGED, updated, Severity.INFO, payload, now));
        return updated;
    }

    @Override
    public JobDefinition getJob(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return store.findById(jobId).orElseThrow(() -> new NotFoundException("job", jobId));
    }

    @Override
    public List<JobDefinition> listJobs(String yachtId, JobStatus status) {
        return store.find(yachtId, status);
    }

    /* ================= runs ================= */

    @Override
    public JobRunResult runNow(String jobId, String actorUserId, Map<String, Object> payload) {
        JobDefinition job = getJob(jobId);
        return execute(job, now(), RunTrigger.MANUAL, payload == null ? Map.of() : payload, actorUserId);
    }

    @Override
    public RunHistory listRuns(String jobId, Integer limit) {
        getJob(jobId);
        int safeLimit = limit == null ? DEFAULT_RUNS_LIMIT : Math.min(Math.max(limit, 1), MAX_RUNS_LIMIT);
        return new RunHistory(store.findRuns(jobId, safeLimit), store.countRuns(jobId));
    }

    /* ================= tick ================= */

    @Override
    public TickResult tick() {
        Instant now = now();
        TickResult.DueRuns due = processDueJobs(now);
        TickResult.Reminders reminders = processReminders(now);
        TickResult result = new TickResult(now, due, reminders);
        if (result.didWork()) {
            log.info("notify4j tick at={} executed={} failed={} reminderJobs={} remindersSent={}",
                    TimeFormats.iso(now), due.executed(), due.failed(), reminders.jobs(), reminders.sent());
        }
        return result;
    }

    @Override
    public TickResult.DueRuns processDueJobs() {
        return processDueJobs(now());
    }

    @Override
    public TickResult.Reminders processReminders() {
        return processReminders(now());
    }

    TickResult.DueRuns processDueJobs(Instant now) {
        List<JobDefinition> due = store.findDue(now, options.dueBatchSize());
        int executed = 0;
        int failed = 0;

        for (JobDefinition job : due) {
            try {
                Instant scheduledAt = job.nextRunAt() == null ? now : job.nextRunAt();
                execute(job, scheduledAt, RunTrigger.SCHEDULER, Map.of(), null);
                executed++;
            } catch (DuplicateRunException e) {
                failed++;
                log.warn("notify4j due run rejected jobId={} dedupeKey={}", job.id(), e.dedupeKey());
            } catch (RuntimeException e) {
                // already logged by the run
                failed++;
            }
        }
        return new TickResult.DueRuns(executed, failed, due.size());
    }

    TickResult.Reminders processReminders(Instant now) {
        List<JobDefinition> upcoming = store.findUpcoming(now, now.plus(options.reminderLookahead()),
                options.reminderBatchSize());
        int sent = 0;

        for (JobDefinition job : upcoming) {
            try {
                sent += sendReminders(job, now);
            } catch (RuntimeException e) {
                log.warn("notify4j reminders failed jobId={} msg={}", job.id(), e.getMessage(), e);
            }
        }
        return new TickResult.Reminders(upcoming.size(), sent);
    }

    private int sendReminders(JobDefinition job, Instant now) {
        Instant nextRunAt = job.nextRunAt();
        if (nextRunAt == null || job.reminders().isEmpty()) {
            return 0;
        }
        List<String> assignees = recipients.resolveAssignees(job);
        if (assignees.isEmpty()) {
            return 0;
        }

        int sent = 0;
        String nextRunIso = TimeFormats.iso(nextRunAt);

        for (ReminderPolicy reminder : job.reminders()) {
            Instant reminderAt = nextRunAt.minus(Duration.ofHours(reminder.offsetHours()));
            if (reminderAt.isAfter(now)) {
                log.debug("notify4j reminder not due jobId={} offsetHours={} reminderAt={}",
                        job.id(), reminder.offsetHours(), reminderAt);
                continue;
            }

            // editing the schedule moves nextRunAt and therefore starts a fresh dedupe bucket
            String base = "job-reminder:" + job.id() + ":" + nextRunIso + ":offset:" + reminder.offsetHours();

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("jobDefinitionId", job.id());
            payload.put("title", job.title());
            payload.put("module", job.module());
            payload.put("nextRunAt", nextRunIso);
            payload.put("reminderOffsetHours", reminder.offsetHours());
            payload.put("instructionsTemplate", job.instructionsTemplate());

            for (String userId : assignees) {
                for (NotificationChannel channel : reminder.channels()) {
                    NotificationRequest request = new NotificationRequest(
                            userId,
                            job.yachtId(),
                            EventTypes.JOBS_REMINDER_DUE,
                            base + ":user:" + userId + ":channel:" + channel.value(),
                            Severity.WARN,
                            payload,
                            options.runDedupeWindowHours()
                    );
                    if (dispatcher.send(channel, request).isSent()) {
                        sent++;
                    }
                }
            }

            Map<String, Object> candidatePayload = new LinkedHashMap<>(payload);
            candidatePayload.remove("instructionsTemplate");
            emit(jobCandidate(EventTypes.JOBS_REMINDER_DUE, job, Severity.WARN, candidatePayload, now));
        }
        return sent;
    }

    private JobRunResult execute(JobDefinition job, Instant scheduledAt, RunTrigger trigger,
                                 Map<String, Object> payload, String actorUserId) {
        String scheduledIso = TimeFormats.iso(scheduledAt);
        String runKey = "job-run:" + job.id() + ":" + scheduledIso;
        JobRun run = store.createRun(JobRun.pending(job.id(), scheduledAt, trigger, runKey));

        try {
            store.markRunning(run.id(), now());

            List<String> assignees = recipients.resolveAssignees(job);
            Instant executedAt = now();
            boolean overdue = scheduledAt.isBefore(executedAt.minus(options.overdueThreshold()));
            Severity severity = overdue ? Severity.CRITICAL : Severity.INFO;
            String eventType = overdue ? EventTypes.JOBS_OVERDUE : EventTypes.JOBS_REMINDER_DUE;

            // job fields override caller-supplied keys of the same name
            EventPayload callerPayload = EventPayload.of(payload);
            Map<String, Object> runFields = new LinkedHashMap<>();
            runFields.put("title", job.title());
            runFields.put("module", job.module());
            runFields.put("scheduledAt", scheduledIso);
            runFields.put("trigger", trigger.value());
            String instructions = renderer.render(job.instructionsTemplate(), callerPayload.merge(runFields).asMap());

            runFields.put("jobDefinitionId", job.id());
            runFields.put("jobRunId", run.id());
            runFields.put("instructions", instructions);
            runFields.put("actorUserId", actorUserId);
            Map<String, Object> eventPayload = callerPayload.merge(runFields).asMap();

            int delivered = 0;
            for (String userId : assignees) {
                NotificationRequest request = new NotificationRequest(
                        userId,
                        job.yachtId(),
                        eventType,
                        runKey + ":user:" + userId,
                        severity,
                        eventPayload,
                        options.runDedupeWindowHours()
                );
                if (dispatcher.maybeSendInApp(request).isSent()) {
                    delivered++;
                }
            }

            Map<String, Object> candidatePayload = new LinkedHashMap<>();
            candidatePayload.put("jobDefinitionId", job.id());
            candidatePayload.put("jobRunId", run.id());
            candidatePayload.put("title", job.title());
            candidatePayload.put("module", job.module());
            candidatePayload.put("scheduledAt", scheduledIso);
            candidatePayload.put("delivered", delivered);
            candidatePayload.put("assigneeUserIds", List.copyOf(assignees));
            candidatePayload.put("trigger", trigger.value());
            candidatePayload.put("ranAt", TimeFormats.iso(executedAt));
            ruleEngine.dispatchCandidates(List.of(
                    jobCandidate(eventType, job, severity, candidatePayload, executedAt)));

            // from scheduledAt, not now, so a late tick does not shift the cadence
            Instant nextRunAt = job.status().isSchedulable()
                    ? ScheduleCalculator.computeNextRunAt(job.schedule(), scheduledAt)
                    : null;

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("delivered", delivered);
            summary.put("assignees", List.copyOf(assignees));
            summary.put("trigger", trigger.value());
            summary.put("renderedInstructions", instructions);

            Instant finishedAt = now();
            JobRun completed = store.completeRun(run.id(), finishedAt, summary, job.id(), job.updatedAt(),
                    finishedAt, nextRunAt);
            JobDefinition advanced = store.findById(job.id()).orElseThrow(() -> new NotFoundException("job", job.id()));

            log.info("notify4j job run completed jobId={} runId={} trigger={} delivered={} nextRunAt={}",
                    job.id(), run.id(), trigger.value(), delivered, advanced.nextRunAt());
            return new JobRunResult(completed, advanced, delivered);
        } catch (RuntimeException e) {
            log.error("notify4j job run failed jobId={} runId={} msg={}", job.id(), run.id(), e.getMessage(), e);
            try {
                store.failRun(run.id(), now(), e.getMessage() == null ? "unknown_error" : e.getMessage());
            } catch (RuntimeException markFailure) {
                e.addSuppressed(markFailure);
            }
            throw e;
        }
    }

    private void emit(EventCandidate candidate) {
        try {
            ruleEngine.dispatchCandidates(List.of(candidate));
        } catch (RuntimeException e) {
            log.warn("notify4j candidate dispatch failed eventType={} entityId={} msg={}",
                    candidate.type(), candidate.entityId(), e.getMessage(), e);
        }
    }

    private static EventCandidate jobCandidate(String type, JobDefinition job, Severity severity,
                                               Map<String, Object> payload, Instant occurredAt) {
        return EventCandidate.builder(type, MODULE)
                .yachtId(job.yachtId())
                .entity(ENTITY_TYPE, job.id())
                .severity(severity)
                .payload(payload)
                .occurredAt(occurredAt)
                .build();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
