package io.notify4j.core;

public enum RunTrigger {

    SCHEDULER("scheduler"),
    MANUAL("manual");

    private final String value;

    RunTrigger(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
