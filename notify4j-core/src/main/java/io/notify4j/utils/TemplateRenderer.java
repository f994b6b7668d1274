package io.notify4j.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.core.EventPayload;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{path}}} placeholders from a variable map.
 *
 * <p>Paths are dot-separated and walk nested maps. Missing values render as an empty string,
 * maps and lists as JSON.
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_.-]+)\\s*\\}\\}");

    private final ObjectMapper objectMapper;

    public TemplateRenderer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public String render(String template, Map<String, ?> variables) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            Object value = EventPayload.resolvePath(variables, m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(stringify(value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray()) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("template value is not serializable: " + e.getOriginalMessage(), e);
            }
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            BigDecimal n = EventPayload.toNumber(value);
            return n == null ? String.valueOf(value) : n.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
