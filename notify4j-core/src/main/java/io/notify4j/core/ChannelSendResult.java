package io.notify4j.core;

/**
 * Transport verdict returned by a {@code ChannelSender}.
 */
public record ChannelSendResult(DeliveryStatus status, String detail) {

    public ChannelSendResult {
        if (status != DeliveryStatus.SENT && status != DeliveryStatus.SKIPPED && status != DeliveryStatus.FAILED) {
            throw new IllegalArgumentException("transport status must be SENT, SKIPPED or FAILED: " + status);
        }
    }

    public static ChannelSendResult sent() {
        return new ChannelSendResult(DeliveryStatus.SENT, null);
    }

    public static ChannelSendResult skipped(String reason) {
        return new ChannelSendResult(DeliveryStatus.SKIPPED, reason);
    }

    public static ChannelSendResult failed(String error) {
        return new ChannelSendResult(DeliveryStatus.FAILED, error == null ? "unknown_error" : error);
    }
}
