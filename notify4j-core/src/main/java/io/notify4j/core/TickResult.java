package io.notify4j.core;

import java.time.Instant;

/**
 * Outcome of one scheduler tick.
 */
public record TickResult(Instant at, DueRuns dueRuns, Reminders reminders) {

    public record DueRuns(int executed, int failed, int total) {
    }

    public record Reminders(int jobs, int sent) {
    }

    public boolean didWork() {
        return dueRuns.total() > 0 || reminders.sent() > 0;
    }
}
