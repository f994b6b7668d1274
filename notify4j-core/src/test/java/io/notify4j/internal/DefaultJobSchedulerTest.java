package io.notify4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.ChannelSender;
import io.notify4j.RuleEngine;
import io.notify4j.core.AssignmentPolicy;
import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.CreateJobRequest;
import io.notify4j.core.DispatchSummary;
import io.notify4j.core.DuplicateRunException;
import io.notify4j.core.EventCandidate;
import io.notify4j.core.EventTypes;
import io.notify4j.core.JobDefinition;
import io.notify4j.core.JobRun;
import io.notify4j.core.JobRunResult;
import io.notify4j.core.JobRunStatus;
import io.notify4j.core.JobSchedule;
import io.notify4j.core.JobStatus;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.MessageTemplate;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationRule;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.RecipientPolicy;
import io.notify4j.core.ReminderPolicy;
import io.notify4j.core.Roles;
import io.notify4j.core.RuleScope;
import io.notify4j.core.RunHistory;
import io.notify4j.core.RunTrigger;
import io.notify4j.core.SchedulerOptions;
import io.notify4j.core.Severity;
import io.notify4j.core.TickResult;
import io.notify4j.core.UpdateJobRequest;
import io.notify4j.core.ValidationException;
import io.notify4j.internal.channel.UnconfiguredPushSender;
import io.notify4j.utils.TemplateRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultJobSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private MutableClock clock;
    private InMemoryJobStore jobs;
    private InMemoryRuleStore rules;
    private InMemoryLedger ledger;
    private FakeMembership membership;
    private LedgerDispatcher dispatcher;
    private DefaultRuleEngine ruleEngine;
    private DefaultJobScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(T0);
        jobs = new InMemoryJobStore();
        rules = new InMemoryRuleStore();
        ledger = new InMemoryLedger();
        membership = new FakeMembership()
                .member(Roles.CAPTAIN, "y-1", "cap-1")
                .member(Roles.CHIEF_ENGINEER, "y-1", "eng-1");

        ChannelSender email = mock(ChannelSender.class);
        when(email.send(any())).thenReturn(ChannelSendResult.sent());
        dispatcher = new LedgerDispatcher(ledger, null, email, new UnconfiguredPushSender(), clock);
        ruleEngine = new DefaultRuleEngine(rules, new InMemoryAlertStore(), dispatcher,
                new RecipientResolver(membership), new TemplateRenderer(new ObjectMapper()), clock);
        scheduler = newScheduler(ruleEngine);
    }

    @Test
    void createJobShouldComputeNextRunAtAndEmitCreatedCandidate() {
        rules.insert(watcherRule(EventTypes.JOBS_CREATED));

        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));

        assertNotNull(job.id());
        assertEquals(T0.plus(Duration.ofDays(1)), job.nextRunAt());
        assertEquals("UTC", job.schedule().timezone());
        assertEquals("admin-1", job.createdByUserId());

        List<LedgerEntry> sent = ledger.sent(NotificationChannel.IN_APP);
        assertEquals(1, sent.size());
        assertEquals("watcher", sent.get(0).userId());
        assertEquals(EventTypes.JOBS_CREATED, sent.get(0).type());
    }

    @Test
    void pausedJobShouldHaveNoNextRun() {
        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.PAUSED, List.of()));
        assertNull(job.nextRunAt());
    }

    @Test
    void invalidJobShouldNotBePersisted() {
        CreateJobRequest duplicateOffsets = dailyJob(JobStatus.ACTIVE, List.of(
                ReminderPolicy.of(2, NotificationChannel.IN_APP),
                ReminderPolicy.of(24, NotificationChannel.EMAIL),
                ReminderPolicy.of(2, NotificationChannel.EMAIL)));

        ValidationException e = assertThrows(ValidationException.class,
                () -> scheduler.createJob("admin-1", duplicateOffsets));
        assertEquals("duplicate reminder offsetHours: 2", e.getMessage());

        CreateJobRequest badCron = new CreateJobRequest("Bilge check", "maintenance", "y-1", "Check",
                JobSchedule.cron("*/5 * * * *"), AssignmentPolicy.ofRoles(Roles.CAPTAIN), null, null);
        assertThrows(ValidationException.class, () -> scheduler.createJob("admin-1", badCron));
        assertTrue(jobs.jobs.isEmpty());
    }

    @Test
    void updateJobShouldRecomputeOrClearNextRun() {
        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        clock.advance(Duration.ofHours(3));

        JobDefinition renamed = scheduler.updateJob(job.id(), new UpdateJobRequest("Renamed", null, null, null,
                null, null, null, null));
        assertEquals("Renamed", renamed.title());
        assertEquals(job.nextRunAt(), renamed.nextRunAt());

        JobDefinition paused = scheduler.updateJob(job.id(), UpdateJobRequest.status(JobStatus.PAUSED));
        assertNull(paused.nextRunAt());

        JobDefinition resumed = scheduler.updateJob(job.id(), UpdateJobRequest.status(JobStatus.ACTIVE));
        assertEquals(clock.instant().plus(Duration.ofDays(1)), resumed.nextRunAt());

        JobDefinition rescheduled = scheduler.updateJob(job.id(), UpdateJobRequest.schedule(JobSchedule.everyHours(6)));
        assertEquals(clock.instant().plus(Duration.ofHours(6)), rescheduled.nextRunAt());

        assertThrows(NotFoundException.class, () -> scheduler.updateJob("missing", UpdateJobRequest.status(JobStatus.PAUSED)));
    }

    @Test
    void tickShouldExecuteDueJobAndAdvanceFromScheduledAt() {
        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        Instant scheduledAt = job.nextRunAt();
        clock.set(scheduledAt.plus(Duration.ofMinutes(5)));

        TickResult result = scheduler.tick();

        assertEquals(new TickResult.DueRuns(1, 0, 1), result.dueRuns());
        JobDefinition advanced = scheduler.getJob(job.id());
        assertEquals(scheduledAt.plus(Duration.ofDays(1)), advanced.nextRunAt());
        assertEquals(clock.instant(), advanced.lastRunAt());

        JobRun run = jobs.runsOf(job.id()).get(0);
        assertEquals(JobRunStatus.COMPLETED, run.status());
        assertEquals(RunTrigger.SCHEDULER, run.trigger());
        assertEquals("job-run:" + job.id() + ":2026-03-03T08:00:00.000Z", run.dedupeKey());
        assertEquals(2, run.summary().get("delivered"));
        assertEquals("Inspect bilge pumps on y-1 (Bilge check)", run.summary().get("renderedInstructions"));

        List<LedgerEntry> sent = ledger.sent(NotificationChannel.IN_APP);
        assertEquals(2, sent.size());
        assertEquals(EventTypes.JOBS_REMINDER_DUE, sent.get(0).type());
        assertEquals("job-run:" + job.id() + ":2026-03-03T08:00:00.000Z:user:cap-1", sent.get(0).dedupeKey());

        assertEquals(new TickResult.DueRuns(0, 0, 0), scheduler.tick().dueRuns());
    }

    @Test
    void lateRunShouldBeOverdueAndCritical() {
        rules.insert(watcherRule(EventTypes.JOBS_OVERDUE).toBuilder().minSeverity(Severity.CRITICAL).build());
        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        clock.set(job.nextRunAt().plus(Duration.ofHours(2)));

        scheduler.tick();

        List<LedgerEntry> sent = ledger.sent(NotificationChannel.IN_APP);
        assertTrue(sent.stream().anyMatch(e -> e.userId().equals("cap-1") && e.type().equals(EventTypes.JOBS_OVERDUE)));
        assertTrue(sent.stream().anyMatch(e -> e.userId().equals("watcher") && e.type().equals(EventTypes.JOBS_OVERDUE)));
    }

    @Test
    void failedRunShouldKeepNextRunAndAllowRetry() {
        RuleEngine flaky = mock(RuleEngine.class);
        DefaultJobScheduler isolated = newScheduler(flaky);
        JobDefinition job = isolated.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        clock.set(job.nextRunAt());

        when(flaky.dispatchCandidates(any())).thenThrow(new IllegalStateException("rule store offline"));
        assertEquals(new TickResult.DueRuns(0, 1, 1), isolated.processDueJobs());

        JobRun failed = jobs.runsOf(job.id()).get(0);
        assertEquals(JobRunStatus.FAILED, failed.status());
        assertEquals("rule store offline", failed.summary().get("error"));
        assertEquals(job.nextRunAt(), isolated.getJob(job.id()).nextRunAt());

        doReturn(DispatchSummary.empty()).when(flaky).dispatchCandidates(any());
        assertEquals(new TickResult.DueRuns(1, 0, 1), isolated.processDueJobs());
        assertEquals(2, jobs.countRuns(job.id()));
    }

    @Test
    void pauseDuringRunShouldKeepJobUnscheduled() {
        RuleEngine engine = mock(RuleEngine.class);
        DefaultJobScheduler racing = newScheduler(engine);
        JobDefinition job = racing.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        clock.set(job.nextRunAt());
        editDuringRun(engine, () -> racing.updateJob(job.id(), UpdateJobRequest.status(JobStatus.PAUSED)));

        assertEquals(new TickResult.DueRuns(1, 0, 1), racing.processDueJobs());

        JobDefinition after = racing.getJob(job.id());
        assertEquals(JobStatus.PAUSED, after.status());
        assertNull(after.nextRunAt());
        assertEquals(clock.instant(), after.lastRunAt());
        assertEquals(JobRunStatus.COMPLETED, jobs.runsOf(job.id()).get(0).status());
    }

    @Test
    void scheduleEditDuringRunShouldWin() {
        RuleEngine engine = mock(RuleEngine.class);
        DefaultJobScheduler racing = newScheduler(engine);
        JobDefinition job = racing.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        clock.set(job.nextRunAt().plus(Duration.ofMinutes(1)));
        editDuringRun(engine, () -> racing.updateJob(job.id(), UpdateJobRequest.schedule(JobSchedule.everyHours(6))));

        JobRunResult result = racing.runNow(job.id(), "admin-1", null);

        JobDefinition after = racing.getJob(job.id());
        assertEquals(clock.instant().plus(Duration.ofHours(6)), after.nextRunAt());
        assertEquals(after.nextRunAt(), result.job().nextRunAt());
        assertEquals(clock.instant(), after.lastRunAt());
    }

    @Test
    void oneFailingJobShouldNotStopTheBatch() {
        membership.failFor("y-broken");
        JobDefinition broken = scheduler.createJob("admin-1", new CreateJobRequest("Broken", "maintenance", "y-broken",
                "x", JobSchedule.everyHours(1), AssignmentPolicy.ofRoles(Roles.CAPTAIN), null, null));
        JobDefinition healthy = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));

        TickResult.DueRuns due = scheduler.processDueJobs(T0.plus(Duration.ofDays(1)));

        assertEquals(new TickResult.DueRuns(1, 1, 2), due);
        assertEquals(JobRunStatus.FAILED, jobs.runsOf(broken.id()).get(0).status());
        assertEquals(JobRunStatus.COMPLETED, jobs.runsOf(healthy.id()).get(0).status());
    }

    @Test
    void runNowShouldMergePayloadAndKeepPausedJobUnscheduled() {
        JobDefinition job = scheduler.createJob("admin-1", new CreateJobRequest("Engine", "maintenance", "y-1",
                "Check {{area}} ({{trigger}})", JobSchedule.everyDays(1), AssignmentPolicy.users("eng-1"),
                null, JobStatus.PAUSED));

        JobRunResult result = scheduler.runNow(job.id(), "admin-1", Map.of("area", "engine room"));

        assertEquals(1, result.delivered());
        assertEquals(RunTrigger.MANUAL, result.run().trigger());
        assertEquals(clock.instant(), result.run().scheduledAt());
        assertNull(result.job().nextRunAt());
        assertNull(scheduler.getJob(job.id()).nextRunAt());

        LedgerEntry entry = ledger.sent(NotificationChannel.IN_APP).get(0);
        assertEquals("Check engine room (manual)", entry.payload().get("instructions"));
        assertEquals("admin-1", entry.payload().get("actorUserId"));
        assertEquals("engine room", entry.payload().get("area"));

        DuplicateRunException dup = assertThrows(DuplicateRunException.class,
                () -> scheduler.runNow(job.id(), "admin-1", null));
        assertEquals(result.run().dedupeKey(), dup.dedupeKey());
    }

    @Test
    void runPayloadShouldLetJobFieldsOverrideCallerKeys() {
        JobDefinition job = scheduler.createJob("admin-1", new CreateJobRequest("Engine", "maintenance", "y-1",
                "{{title}} / {{trigger}} / {{shift}}", JobSchedule.everyDays(1), AssignmentPolicy.users("eng-1"),
                null, JobStatus.ACTIVE));

        scheduler.runNow(job.id(), "admin-1", Map.of("title", "spoofed", "trigger", "cron", "shift", "night"));

        LedgerEntry entry = ledger.sent(NotificationChannel.IN_APP).get(0);
        assertEquals("Engine / manual / night", entry.payload().get("instructions"));
        assertEquals("Engine", entry.payload().get("title"));
        assertEquals("manual", entry.payload().get("trigger"));
        assertEquals("night", entry.payload().get("shift"));
        assertEquals(job.id(), entry.payload().get("jobDefinitionId"));
    }

    @Test
    void listRunsShouldClampLimitAndOrderNewestFirst() {
        JobDefinition job = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        for (int i = 0; i < 3; i++) {
            scheduler.runNow(job.id(), "admin-1", null);
            clock.advance(Duration.ofMinutes(1));
        }

        RunHistory all = scheduler.listRuns(job.id(), null);
        assertEquals(3, all.total());
        assertTrue(all.items().get(0).scheduledAt().isAfter(all.items().get(2).scheduledAt()));

        RunHistory one = scheduler.listRuns(job.id(), 0);
        assertEquals(1, one.items().size());
        assertEquals(3, one.total());

        assertThrows(NotFoundException.class, () -> scheduler.listRuns("missing", 5));
    }

    @Test
    void remindersShouldFireOncePerOffset() {
        rules.insert(watcherRule(EventTypes.JOBS_REMINDER_DUE).toBuilder().minSeverity(Severity.WARN).build());
        JobDefinition job = scheduler.createJob("admin-1", new CreateJobRequest("Safety drill", "safety", "y-1",
                "Run the drill", JobSchedule.everyDays(2), AssignmentPolicy.ofRoles(Roles.CAPTAIN),
                List.of(ReminderPolicy.of(2, NotificationChannel.IN_APP), ReminderPolicy.of(24, NotificationChannel.IN_APP)),
                null));

        assertEquals(new TickResult.Reminders(1, 0), scheduler.processReminders());

        clock.set(job.nextRunAt().minus(Duration.ofHours(24)).plusSeconds(60));
        assertEquals(new TickResult.Reminders(1, 1), scheduler.processReminders());
        assertEquals(new TickResult.Reminders(1, 0), scheduler.processReminders());

        clock.set(job.nextRunAt().minus(Duration.ofHours(2)).plusSeconds(60));
        assertEquals(new TickResult.Reminders(1, 1), scheduler.processReminders());

        List<LedgerEntry> captainReminders = ledger.sent(NotificationChannel.IN_APP).stream()
                .filter(e -> e.userId().equals("cap-1"))
                .toList();
        assertEquals(2, captainReminders.size());
        assertEquals("job-reminder:" + job.id() + ":2026-03-04T08:00:00.000Z:offset:24:user:cap-1:channel:in_app",
                captainReminders.get(0).dedupeKey());

        List<LedgerEntry> watcher = ledger.sent(NotificationChannel.IN_APP).stream()
                .filter(e -> e.userId().equals("watcher"))
                .toList();
        // both offsets share the rule's dedupe bucket
        assertEquals(1, watcher.size());
        assertTrue(watcher.stream().noneMatch(e -> e.payload().containsKey("instructionsTemplate")));
    }

    @Test
    void tickShouldReportWork() {
        scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        TickResult idle = scheduler.tick();
        assertEquals(T0, idle.at());
        assertEquals(new TickResult.Reminders(1, 0), idle.reminders());
        assertFalse(idle.didWork());

        clock.set(T0.plus(Duration.ofDays(1)));
        assertTrue(scheduler.tick().didWork());
    }

    @Test
    void listJobsShouldFilter() {
        JobDefinition active = scheduler.createJob("admin-1", dailyJob(JobStatus.ACTIVE, List.of()));
        scheduler.createJob("admin-1", dailyJob(JobStatus.PAUSED, List.of()));

        List<JobDefinition> found = scheduler.listJobs("y-1", JobStatus.ACTIVE);
        assertEquals(1, found.size());
        assertEquals(active.id(), found.get(0).id());
        assertEquals(2, scheduler.listJobs(null, null).size());
    }

    // runs the edit when the run hands its own candidate to the rule engine
    private static void editDuringRun(RuleEngine engine, Runnable edit) {
        when(engine.dispatchCandidates(any())).thenAnswer(invocation -> {
            List<EventCandidate> candidates = invocation.getArgument(0);
            String type = candidates.get(0).type();
            if (type.equals(EventTypes.JOBS_REMINDER_DUE) || type.equals(EventTypes.JOBS_OVERDUE)) {
                edit.run();
            }
            return DispatchSummary.empty();
        });
    }

    private DefaultJobScheduler newScheduler(RuleEngine engine) {
        return new DefaultJobScheduler(jobs, dispatcher, engine, new RecipientResolver(membership),
                new TemplateRenderer(new ObjectMapper()), SchedulerOptions.defaults(), clock);
    }

    private static CreateJobRequest dailyJob(JobStatus status, List<ReminderPolicy> reminders) {
        return new CreateJobRequest(
                "  Bilge check ",
                "maintenance",
                "y-1",
                "Inspect bilge pumps on y-1 ({{title}})",
                JobSchedule.everyDays(1),
                new AssignmentPolicy(null, List.of(Roles.CAPTAIN, Roles.CHIEF_ENGINEER), null),
                reminders,
                status
        );
    }

    private static NotificationRule watcherRule(String eventType) {
        return NotificationRule.builder()
                .name("watch " + eventType)
                .module("jobs")
                .eventType(eventType)
                .scope(RuleScope.fleet())
                .channels(List.of(NotificationChannel.IN_APP))
                .template(new MessageTemplate("{{title}}", "{{eventType}}"))
                .recipientPolicy(RecipientPolicy.users("watcher"))
                .updatedAt(T0)
                .build();
    }
}
