package io.notify4j.core;

import java.util.Locale;

/**
 * Status persisted on a ledger entry.
 */
public enum DeliveryStatus {
    SENT,
    SKIPPED,
    FAILED,
    READ;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
