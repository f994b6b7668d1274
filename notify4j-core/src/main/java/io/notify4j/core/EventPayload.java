package io.notify4j.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable key/value payload carried by an {@link EventCandidate}.
 *
 * <p>Values follow JSON shapes: strings, numbers, booleans, nested maps and lists. Accessors never throw
 * on a missing or wrong-typed field; they return an empty result instead.
 */
public final class EventPayload {

    private static final EventPayload EMPTY = new EventPayload(Map.of());

    private final Map<String, Object> values;

    private EventPayload(Map<String, Object> values) {
        this.values = values;
    }

    public static EventPayload empty() {
        return EMPTY;
    }

    public static EventPayload of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap tolerates null values, Map.copyOf does not
        return new EventPayload(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * Resolve a dot path (e.g. {@code "part.sku"}) through nested maps.
     */
    public Object path(String dotPath) {
        return resolvePath(values, dotPath);
    }

    public Optional<String> readOptionalString(String key) {
        Object v = values.get(key);
        if (!(v instanceof String s)) {
            return Optional.empty();
        }
        String trimmed = s.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    /**
     * Dedupe bucket used by rule dedupe keys; {@code "default"} unless the payload carries a string bucket.
     */
    public String bucket() {
        Object v = values.get("bucket");
        return v instanceof String s ? s : "default";
    }

    /**
     * New payload with {@code overrides} applied on top of this one.
     */
    public EventPayload merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides);
        return new EventPayload(Collections.unmodifiableMap(merged));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public static Object resolvePath(Map<String, ?> source, String dotPath) {
        if (source == null || dotPath == null || dotPath.isEmpty()) {
            return null;
        }
        Object current = source;
        for (String segment : dotPath.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    /**
     * Numeric coercion: finite numbers and non-blank numeric strings; everything else is null.
     */
    public static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        if (value instanceof Double d) {
            return d.isNaN() || d.isInfinite() ? null : BigDecimal.valueOf(d);
        }
        if (value instanceof Float f) {
            return f.isNaN() || f.isInfinite() ? null : BigDecimal.valueOf(f.doubleValue());
        }
        if (value instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EventPayload other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "EventPayload" + values;
    }
}
