package io.notify4j.core;

public enum CadenceMode {
    ONCE,
    HOURLY,
    DAILY,
    EVERY_N_HOURS,
    EVERY_N_DAYS
}
