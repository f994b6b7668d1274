package io.notify4j.core;

/**
 * What happened to one channel attempt.
 *
 * @param entry the ledger row written for this attempt, or {@code null} for dedupe skips (nothing is written)
 */
public record DeliveryResult(
        NotificationChannel channel,
        DeliveryOutcome outcome,
        String reason,
        LedgerEntry entry
) {
    public boolean isSent() {
        return outcome.isSent();
    }
}
