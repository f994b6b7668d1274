package io.notify4j;

import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRequest;

/**
 * Pluggable transport for one channel (email provider, push provider).
 */
public interface ChannelSender {

    NotificationChannel channel();

    ChannelSendResult send(NotificationRequest request) throws Exception;
}
