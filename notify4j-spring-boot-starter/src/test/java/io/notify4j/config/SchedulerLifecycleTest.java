package io.notify4j.config;

import io.notify4j.JobScheduler;
import io.notify4j.core.TickResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerLifecycleTest {

    private static final TickResult IDLE = new TickResult(Instant.parse("2026-03-02T10:00:00Z"),
            new TickResult.DueRuns(0, 0, 0), new TickResult.Reminders(0, 0));

    private final JobScheduler scheduler = mock(JobScheduler.class);
    private final AtomicReference<Thread> tickThread = new AtomicReference<>();
    private SchedulerLifecycle lifecycle;

    @AfterEach
    void tearDown() {
        if (lifecycle != null) {
            lifecycle.stop();
        }
    }

    @Test
    void failingTicksShouldBeCountedAndRetried() throws Exception {
        CountDownLatch calls = new CountDownLatch(3);
        when(scheduler.tick()).thenAnswer(invocation -> {
            tickThread.set(Thread.currentThread());
            calls.countDown();
            throw new IllegalStateException("mongo unavailable");
        });
        lifecycle = new SchedulerLifecycle(scheduler, Duration.ofMillis(20));

        lifecycle.start();

        assertThat(calls.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(lifecycle.consecutiveFailures()).isGreaterThanOrEqualTo(2);
        assertStopEndsThread();
    }

    @Test
    void successfulTickShouldResetFailureCount() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch secondSuccess = new CountDownLatch(1);
        when(scheduler.tick()).thenAnswer(invocation -> {
            tickThread.set(Thread.currentThread());
            int n = invocations.incrementAndGet();
            if (n <= 2) {
                throw new IllegalStateException("tick " + n + " failed");
            }
            if (n == 4) {
                secondSuccess.countDown();
            }
            return IDLE;
        });
        lifecycle = new SchedulerLifecycle(scheduler, Duration.ofMillis(20));

        lifecycle.start();

        assertThat(secondSuccess.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(lifecycle.consecutiveFailures()).isZero();
        assertStopEndsThread();
    }

    @Test
    void stopShouldInterruptAThreadWaitingForTheNextTick() throws Exception {
        CountDownLatch firstTick = new CountDownLatch(1);
        when(scheduler.tick()).thenAnswer(invocation -> {
            tickThread.set(Thread.currentThread());
            firstTick.countDown();
            return IDLE;
        });
        lifecycle = new SchedulerLifecycle(scheduler, Duration.ofHours(1));

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(firstTick.await(5, TimeUnit.SECONDS)).isTrue();

        assertStopEndsThread();
    }

    @Test
    void backoffShouldDoubleFromOneSecondUpToProcessEvery() {
        lifecycle = new SchedulerLifecycle(scheduler, Duration.ofSeconds(10));

        assertThat(lifecycle.backoff(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(lifecycle.backoff(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(lifecycle.backoff(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(lifecycle.backoff(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(lifecycle.backoff(40)).isEqualTo(Duration.ofSeconds(10));
    }

    private void assertStopEndsThread() throws InterruptedException {
        Thread thread = tickThread.get();
        assertThat(thread).isNotNull();
        assertThat(thread.getName()).isEqualTo("notify4j.scheduler");

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        thread.join(TimeUnit.SECONDS.toMillis(5));
        assertThat(thread.isAlive()).isFalse();
    }
}
