package io.notify4j.config;

import io.notify4j.JobScheduler;
import io.notify4j.core.TickResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs {@link JobScheduler#tick()} every {@code processEvery} while the Spring container is running.
 *
 * <p>Ticks run on a single daemon thread, so two ticks of the same instance never overlap.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final JobScheduler scheduler;
    private final Duration processEvery;
    private volatile boolean running = false;
    private Thread tickThread;
    private volatile int systemErrorCount;

    public SchedulerLifecycle(JobScheduler scheduler, Duration processEvery) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.processEvery = Objects.requireNonNull(processEvery, "notify4j.processEvery must not be null");
        if (processEvery.isZero() || processEvery.isNegative()) {
            throw new IllegalArgumentException("notify4j.processEvery must be a positive duration");
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        tickThread = new Thread(this::tickLoop);
        tickThread.setName("notify4j.scheduler");
        tickThread.setDaemon(true);
        tickThread.start();
        log.info("notify4j scheduler started processEvery={}", processEvery);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (tickThread != null) {
            tickThread.interrupt();
            tickThread = null;
        }
        log.info("notify4j scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void tickLoop() {
        while (running) {
            Duration sleep = processEvery;
            try {
                TickResult result = scheduler.tick();
                systemErrorCount = 0;
                log.debug("notify4j tick finished at={} executed={} failed={} remindersSent={}",
                        result.at(), result.dueRuns().executed(), result.dueRuns().failed(), result.reminders().sent());
            } catch (Exception e) {
                systemErrorCount++;
                log.error("notify4j tick failed count={} msg={}", systemErrorCount, e.getMessage(), e);
                sleep = backoff(systemErrorCount);
            }

            try {
                Thread.sleep(sleep.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    int consecutiveFailures() {
        return systemErrorCount;
    }

    // Exponential backoff for repeated tick failures starting at one second, never longer than the regular period.
    Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), processEvery.toMillis());
        return Duration.ofMillis(ms);
    }
}
