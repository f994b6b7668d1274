package io.notify4j.utils;

import io.notify4j.core.EventPayload;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates rule conditions against an event payload.
 * <p>
 * Two shapes are accepted:
 * <ul>
 *   <li>{@code {"all": [{"field": "a.b", "op": "gte", "value": 3}, ...]}}: every clause must hold</li>
 *   <li>a flat map {@code {"priority": "Critical"}}: every key must equal the payload value</li>
 * </ul>
 * An empty condition map always matches. Unknown operators never match.
 */
public final class ConditionMatcher {

    public static final String ALL = "all";

    private ConditionMatcher() {
    }

    public static boolean matches(Map<String, ?> conditions, EventPayload payload) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        EventPayload source = payload == null ? EventPayload.empty() : payload;

        if (conditions.get(ALL) instanceof List<?> clauses) {
            for (Object clause : clauses) {
                if (!evaluateClause(clause instanceof Map<?, ?> m ? m : Map.of(), source)) {
                    return false;
                }
            }
            return true;
        }

        for (Map.Entry<String, ?> e : conditions.entrySet()) {
            if (!valuesEqual(source.path(e.getKey()), e.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * A clause without a field is vacuously true; a missing operator means {@code eq}.
     */
    public static boolean evaluateClause(Map<?, ?> clause, EventPayload payload) {
        String field = clause.get("field") instanceof String s ? s : "";
        String op = clause.get("op") instanceof String s ? s : "eq";
        Object expected = clause.get("value");
        if (field.isEmpty()) {
            return true;
        }

        Object actual = payload.path(field);

        switch (op) {
            case "eq":
                return valuesEqual(actual, expected);
            case "neq":
                return !valuesEqual(actual, expected);
            case "gt":
            case "gte":
            case "lt":
            case "lte":
                return compareNumbers(op, actual, expected);
            case "in":
                return expected instanceof Collection<?> in && containsValue(in, actual);
            case "not_in":
                return expected instanceof Collection<?> notIn && !containsValue(notIn, actual);
            case "contains":
                return actual instanceof String a && expected instanceof String b
                        && a.toLowerCase(Locale.ROOT).contains(b.toLowerCase(Locale.ROOT));
            default:
                return false;
        }
    }

    /**
     * Strict equality, except that two numbers compare by value (so {@code 3}, {@code 3L} and {@code 3.0} are equal).
     */
    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            BigDecimal a = EventPayload.toNumber(actual);
            BigDecimal b = EventPayload.toNumber(expected);
            return a != null && b != null && a.compareTo(b) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean containsValue(Collection<?> values, Object actual) {
        for (Object v : values) {
            if (valuesEqual(actual, v)) {
                return true;
            }
        }
        return false;
    }

    private static boolean compareNumbers(String op, Object actual, Object expected) {
        BigDecimal a = EventPayload.toNumber(actual);
        BigDecimal b = EventPayload.toNumber(expected);
        if (a == null || b == null) {
            return false;
        }
        int cmp = a.compareTo(b);
        return switch (op) {
            case "gt" -> cmp > 0;
            case "gte" -> cmp >= 0;
            case "lt" -> cmp < 0;
            case "lte" -> cmp <= 0;
            default -> false;
        };
    }
}
