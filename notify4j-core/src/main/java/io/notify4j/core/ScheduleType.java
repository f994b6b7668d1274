package io.notify4j.core;

public enum ScheduleType {

    CRON("cron"),
    INTERVAL_HOURS("interval_hours"),
    INTERVAL_DAYS("interval_days");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
