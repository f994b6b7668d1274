package io.notify4j.core;

/**
 * Result of one channel attempt as seen by callers of the dispatcher.
 *
 * <p>Dedupe skips are normal outcomes and are kept apart from {@link #FAILED}.
 */
public enum DeliveryOutcome {

    SENT("sent"),
    SKIPPED("skipped"),
    SKIPPED_DEDUPE_WINDOW("skipped_dedupe_window"),
    SKIPPED_DAILY_DEDUPE("skipped_daily_dedupe"),
    FAILED("failed");

    private final String value;

    DeliveryOutcome(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isSent() {
        return this == SENT;
    }

    public boolean isDedupeSkip() {
        return this == SKIPPED_DEDUPE_WINDOW || this == SKIPPED_DAILY_DEDUPE;
    }
}
