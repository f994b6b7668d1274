package io.notify4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Enum and map conversions shared by the Mongo stores. Enums are stored as lower-case names.
 */
final class MongoValues {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private MongoValues() {
    }

    static String value(Enum<?> e) {
        return e == null ? null : e.name().toLowerCase(Locale.ROOT);
    }

    static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    }

    static List<String> values(List<? extends Enum<?>> enums) {
        List<String> out = new ArrayList<>(enums == null ? 0 : enums.size());
        if (enums != null) {
            for (Enum<?> e : enums) {
                out.add(value(e));
            }
        }
        return out;
    }

    static <E extends Enum<E>> List<E> enumValues(Class<E> type, List<String> values) {
        List<E> out = new ArrayList<>(values == null ? 0 : values.size());
        if (values != null) {
            for (String v : values) {
                E e = enumValue(type, v);
                if (e != null) {
                    out.add(e);
                }
            }
        }
        return out;
    }

    /**
     * Normalizes a free-form map to plain JSON shapes (maps, lists, strings, numbers, booleans).
     */
    static Map<String, Object> plainMap(ObjectMapper objectMapper, Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(source, MAP_TYPE);
    }

    static List<String> copy(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
