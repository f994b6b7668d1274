package io.notify4j.core;

import java.util.Locale;

public enum JobRunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
