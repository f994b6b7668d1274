package io.notify4j;

import io.notify4j.core.DeliveryResult;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRequest;

import java.util.List;
import java.util.function.Function;

/**
 * Channel dispatch through the notification ledger.
 *
 * <p>Every method returns an outcome; transport errors are recorded, never thrown.
 */
public interface NotificationDispatcher {

    DeliveryResult maybeSendInApp(NotificationRequest request);

    DeliveryResult maybeSendEmail(NotificationRequest request);

    DeliveryResult maybeSendPush(NotificationRequest request);

    default DeliveryResult send(NotificationChannel channel, NotificationRequest request) {
        return switch (channel) {
            case IN_APP -> maybeSendInApp(request);
            case EMAIL -> maybeSendEmail(request);
            case PUSH -> maybeSendPush(request);
        };
    }

    /**
     * Fan out to every recipient on every channel; each (recipient, channel) pair is attempted independently.
     *
     * @param requestFor builds the request for one recipient (typically embedding a per-user dedupe key)
     * @return number of successful sends
     */
    default int dispatchToRecipients(List<String> recipients, List<NotificationChannel> channels,
                                     Function<String, NotificationRequest> requestFor) {
        int sent = 0;
        for (String userId : recipients) {
            NotificationRequest request = requestFor.apply(userId);
            for (NotificationChannel channel : channels) {
                if (send(channel, request).isSent()) {
                    sent++;
                }
            }
        }
        return sent;
    }

    /**
     * @param limit clamped to 1..200
     * @return in-app entries of the user, newest first
     */
    List<LedgerEntry> listInApp(String userId, int limit);

    LedgerEntry markRead(String entryId);
}
