package io.notify4j.core;

public enum NotificationChannel {

    IN_APP("in_app"),
    EMAIL("email"),
    PUSH("push");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static NotificationChannel fromValue(String value) {
        for (NotificationChannel c : values()) {
            if (c.value.equals(value)) {
                return c;
            }
        }
        throw new ValidationException("unsupported channel: " + value);
    }
}
