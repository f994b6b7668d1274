package io.notify4j.spi;

import io.notify4j.core.DeliveryStatus;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.NotificationChannel;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Append-mostly record of every channel attempt, queried for idempotence.
 */
public interface NotificationLedger {

    /**
     * Returns {@code true} when an entry exists for the same user, channel and dedupe key,
     * created at or after {@code since}, whose status is one of {@code statuses}.
     */
    boolean exists(String userId, NotificationChannel channel, String dedupeKey, Instant since,
                   Collection<DeliveryStatus> statuses);

    /**
     * Appends an entry and returns it with its generated id.
     */
    LedgerEntry record(LedgerEntry entry);

    /**
     * @return entries of the user on the channel, newest first
     */
    List<LedgerEntry> findByUser(String userId, NotificationChannel channel, int limit);

    Optional<LedgerEntry> markRead(String entryId);
}
