package io.notify4j.internal;

import io.notify4j.core.CadenceMode;
import io.notify4j.core.CadencePolicy;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.ReminderPolicy;
import io.notify4j.core.RuleScope;
import io.notify4j.core.ScopeType;
import io.notify4j.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.notify4j.core.NotificationChannel.EMAIL;
import static io.notify4j.core.NotificationChannel.IN_APP;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DefinitionValidatorTest {

    @Test
    void duplicateReminderOffsetsShouldBeRejected() {
        List<ReminderPolicy> reminders = List.of(
                ReminderPolicy.of(2, IN_APP),
                ReminderPolicy.of(24, EMAIL),
                ReminderPolicy.of(2, EMAIL));

        ValidationException e = assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeReminders(reminders));
        assertEquals("duplicate reminder offsetHours: 2", e.getMessage());
    }

    @Test
    void remindersShouldBeSortedDescending() {
        List<ReminderPolicy> normalized = DefinitionValidator.normalizeReminders(List.of(
                ReminderPolicy.of(2, IN_APP),
                ReminderPolicy.of(24, EMAIL, EMAIL, IN_APP),
                ReminderPolicy.of(1, IN_APP)));

        assertEquals(List.of(24, 2, 1), normalized.stream().map(ReminderPolicy::offsetHours).toList());
        assertEquals(List.of(EMAIL, IN_APP), normalized.get(0).channels());
    }

    @Test
    void reminderBoundsShouldBeEnforced() {
        assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeReminders(List.of(ReminderPolicy.of(0, IN_APP))));
        assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeReminders(List.of(ReminderPolicy.of(1441, IN_APP))));
        assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeReminders(List.of(new ReminderPolicy(4, List.of()))));
        assertEquals(List.of(), DefinitionValidator.normalizeReminders(null));
    }

    @Test
    void channelsShouldBeNonEmptyAndDistinct() {
        assertThrows(ValidationException.class, () -> DefinitionValidator.normalizeChannels(List.of(), "channels"));
        assertEquals(List.of(NotificationChannel.PUSH, IN_APP), DefinitionValidator.normalizeChannels(
                List.of(NotificationChannel.PUSH, IN_APP, NotificationChannel.PUSH), "channels"));
    }

    @Test
    void scopeShouldBeNormalized() {
        assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeScope(new RuleScope(ScopeType.YACHT, "  ", null, null)));
        assertEquals(RuleScope.fleet(),
                DefinitionValidator.normalizeScope(new RuleScope(ScopeType.FLEET, "y-1", "Part", "p-1")));
        assertEquals(RuleScope.yacht("y-1"),
                DefinitionValidator.normalizeScope(new RuleScope(ScopeType.YACHT, " y-1 ", "Part", null)));
        assertEquals(new RuleScope(ScopeType.ENTITY, null, "Part", null),
                DefinitionValidator.normalizeScope(new RuleScope(ScopeType.ENTITY, "", " Part ", " ")));
    }

    @Test
    void numericRuleSettingsShouldBeBounded() {
        assertEquals(24, DefinitionValidator.normalizeDedupeWindow(null, 24));
        assertEquals(168, DefinitionValidator.normalizeDedupeWindow(168, 24));
        assertThrows(ValidationException.class, () -> DefinitionValidator.normalizeDedupeWindow(169, 24));
        assertThrows(ValidationException.class, () -> DefinitionValidator.normalizeDedupeWindow(0, 24));

        assertEquals(CadencePolicy.daily(), DefinitionValidator.normalizeCadence(null));
        assertThrows(ValidationException.class,
                () -> DefinitionValidator.normalizeCadence(new CadencePolicy(CadenceMode.EVERY_N_DAYS, 366)));
    }

    @Test
    void requiredTextShouldBeTrimmed() {
        assertEquals("Bilge check", DefinitionValidator.requireText("  Bilge check ", "title"));
        ValidationException e = assertThrows(ValidationException.class,
                () -> DefinitionValidator.requireText(" ", "title"));
        assertEquals("title is required", e.getMessage());
    }
}
