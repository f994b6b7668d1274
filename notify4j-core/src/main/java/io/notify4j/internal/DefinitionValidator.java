package io.notify4j.internal;

import io.notify4j.core.CadencePolicy;
import io.notify4j.core.MessageTemplate;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.ReminderPolicy;
import io.notify4j.core.RuleScope;
import io.notify4j.core.ValidationException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Input checks shared by job and rule definitions. Everything here runs before persistence.
 */
public final class DefinitionValidator {

    public static final int MAX_REMINDER_OFFSET_HOURS = 1440;
    public static final int MAX_RULE_DEDUPE_WINDOW_HOURS = 168;
    public static final int MAX_CADENCE_VALUE = 365;

    private DefinitionValidator() {
    }

    /**
     * Unique offsets, sorted descending.
     *
     * @throws ValidationException on a duplicate offset, an offset outside 1..1440 or an empty channel list
     */
    public static List<ReminderPolicy> normalizeReminders(List<ReminderPolicy> reminders) {
        if (reminders == null || reminders.isEmpty()) {
            return List.of();
        }
        Set<Integer> seen = new HashSet<>();
        List<ReminderPolicy> normalized = new ArrayList<>(reminders.size());
        for (ReminderPolicy r : reminders) {
            if (r == null) {
                throw new ValidationException("reminder must not be null");
            }
            if (r.offsetHours() < 1 || r.offsetHours() > MAX_REMINDER_OFFSET_HOURS) {
                throw new ValidationException("reminder offsetHours must be within 1.." + MAX_REMINDER_OFFSET_HOURS
                        + ": " + r.offsetHours());
            }
            if (!seen.add(r.offsetHours())) {
                throw new ValidationException("duplicate reminder offsetHours: " + r.offsetHours());
            }
            normalized.add(new ReminderPolicy(r.offsetHours(), normalizeChannels(r.channels(), "reminder channels")));
        }
        normalized.sort(Comparator.comparingInt(ReminderPolicy::offsetHours).reversed());
        return List.copyOf(normalized);
    }

    /**
     * Non-empty, order-preserving, without duplicates.
     */
    public static List<NotificationChannel> normalizeChannels(List<NotificationChannel> channels, String field) {
        if (channels == null || channels.isEmpty()) {
            throw new ValidationException(field + " must not be empty");
        }
        Set<NotificationChannel> unique = new LinkedHashSet<>();
        for (NotificationChannel c : channels) {
            if (c == null) {
                throw new ValidationException(field + " must not contain null");
            }
            unique.add(c);
        }
        return List.copyOf(unique);
    }

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value.trim();
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static <T> T require(T value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    public static MessageTemplate normalizeTemplate(MessageTemplate template) {
        require(template, "template");
        return new MessageTemplate(requireText(template.title(), "template.title"),
                requireText(template.message(), "template.message"));
    }

    /**
     * A yacht scope needs a yacht id. Entity scope fields are optional wildcards.
     */
    public static RuleScope normalizeScope(RuleScope scope) {
        require(scope, "scope");
        RuleScope s = new RuleScope(scope.type(), trimToNull(scope.yachtId()),
                trimToNull(scope.entityType()), trimToNull(scope.entityId()));
        switch (s.type()) {
            case FLEET:
                return RuleScope.fleet();
            case YACHT:
                if (s.yachtId() == null) {
                    throw new ValidationException("scope.yachtId is required for yacht scope");
                }
                return RuleScope.yacht(s.yachtId());
            default:
                return s;
        }
    }

    public static CadencePolicy normalizeCadence(CadencePolicy cadence) {
        if (cadence == null) {
            return CadencePolicy.daily();
        }
        Integer value = cadence.value();
        if (value != null && (value < 1 || value > MAX_CADENCE_VALUE)) {
            throw new ValidationException("cadence value must be within 1.." + MAX_CADENCE_VALUE + ": " + value);
        }
        return cadence;
    }

    public static int normalizeDedupeWindow(Integer hours, int fallback) {
        if (hours == null) {
            return fallback;
        }
        if (hours < 1 || hours > MAX_RULE_DEDUPE_WINDOW_HOURS) {
            throw new ValidationException("dedupeWindowHours must be within 1.." + MAX_RULE_DEDUPE_WINDOW_HOURS
                    + ": " + hours);
        }
        return hours;
    }
}
