package io.notify4j.core;

/**
 * Severity of an event candidate or a rule threshold. Ordered info &lt; warn &lt; critical.
 */
public enum Severity {

    INFO("info", 1),
    WARN("warn", 2),
    CRITICAL("critical", 3);

    private final String value;
    private final int rank;

    Severity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(Severity other) {
        return this.rank >= other.rank;
    }

    /**
     * Lenient parse: anything that is not "warn" or "critical" is treated as info.
     */
    public static Severity normalize(String value) {
        if (value == null) {
            return INFO;
        }
        String v = value.trim().toLowerCase();
        if ("critical".equals(v)) return CRITICAL;
        if ("warn".equals(v)) return WARN;
        return INFO;
    }

    /**
     * Strict parse used by request validation.
     */
    public static Severity fromValue(String value) {
        for (Severity s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new ValidationException("unsupported severity: " + value);
    }
}
