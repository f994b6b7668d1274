package io.notify4j.internal.channel;

import io.notify4j.ChannelSender;
import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRequest;

/**
 * Placeholder push transport: every attempt is recorded as skipped.
 */
public class UnconfiguredPushSender implements ChannelSender {

    public static final String REASON = "push_provider_not_configured";

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    public ChannelSendResult send(NotificationRequest request) {
        return ChannelSendResult.skipped(REASON);
    }
}
