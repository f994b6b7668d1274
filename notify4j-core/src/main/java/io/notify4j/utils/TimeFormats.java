package io.notify4j.utils;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Instant formatting used inside dedupe keys and payloads.
 */
public final class TimeFormats {

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private TimeFormats() {
    }

    /**
     * UTC ISO-8601 with exactly three fractional digits, e.g. {@code 2025-03-01T08:00:00.000Z}.
     */
    public static String iso(Instant instant) {
        return instant == null ? null : ISO_MILLIS.format(instant);
    }

    public static Instant startOfUtcDay(Instant instant) {
        return instant.truncatedTo(ChronoUnit.DAYS);
    }
}
