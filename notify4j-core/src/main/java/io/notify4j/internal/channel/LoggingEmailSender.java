package io.notify4j.internal.channel;

import io.notify4j.ChannelSender;
import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Email transport used when the host application provides none. Logs the message and reports it sent.
 */
public class LoggingEmailSender implements ChannelSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingEmailSender.class);

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public ChannelSendResult send(NotificationRequest request) {
        log.info("notify4j email userId={} type={} severity={} title={}",
                request.userId(), request.type(), request.severity().value(), request.payload().get("title"));
        return ChannelSendResult.sent();
    }
}
