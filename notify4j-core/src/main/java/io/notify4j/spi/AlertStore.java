package io.notify4j.spi;

import io.notify4j.core.Alert;
import io.notify4j.core.AlertUpsert;

import java.time.Instant;
import java.util.Optional;

/**
 * Thin alert persistence keyed by dedupe string.
 */
public interface AlertStore {

    /**
     * Creates the alert, or refreshes severity, due date and assignee of the one with the same dedupe key.
     */
    Alert upsert(AlertUpsert upsert, Instant now);

    Optional<Alert> resolve(String dedupeKey, Instant at);

    Optional<Alert> findByDedupeKey(String dedupeKey);
}
