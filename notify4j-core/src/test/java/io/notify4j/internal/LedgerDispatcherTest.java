package io.notify4j.internal;

import io.notify4j.ChannelSender;
import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.DeliveryOutcome;
import io.notify4j.core.DeliveryResult;
import io.notify4j.core.DeliveryStatus;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationPreference;
import io.notify4j.core.NotificationRequest;
import io.notify4j.core.Severity;
import io.notify4j.internal.channel.UnconfiguredPushSender;
import io.notify4j.spi.PreferenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LedgerDispatcherTest {

    private MutableClock clock;
    private InMemoryLedger ledger;
    private PreferenceStore preferences;
    private ChannelSender email;
    private LedgerDispatcher dispatcher;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        ledger = new InMemoryLedger();
        preferences = mock(PreferenceStore.class);
        when(preferences.find(any())).thenReturn(Optional.empty());
        email = mock(ChannelSender.class);
        when(email.send(any())).thenReturn(ChannelSendResult.sent());
        dispatcher = new LedgerDispatcher(ledger, preferences, email, new UnconfiguredPushSender(), clock);
    }

    @Test
    void inAppShouldDedupeInsideWindowAndSendAfterIt() {
        NotificationRequest req = request("k1", Severity.INFO, 6);

        assertEquals(DeliveryOutcome.SENT, dispatcher.maybeSendInApp(req).outcome());

        clock.advance(Duration.ofHours(5));
        DeliveryResult dup = dispatcher.maybeSendInApp(req);
        assertEquals(DeliveryOutcome.SKIPPED_DEDUPE_WINDOW, dup.outcome());
        assertEquals("dedupe_window", dup.reason());
        assertNull(dup.entry());
        assertEquals(1, ledger.entries.size());

        clock.advance(Duration.ofHours(2));
        assertEquals(DeliveryOutcome.SENT, dispatcher.maybeSendInApp(req).outcome());
        assertEquals(2, ledger.sent(NotificationChannel.IN_APP).size());
    }

    @Test
    void readEntriesShouldStillCountForInAppDedupe() {
        NotificationRequest req = request("k1", Severity.INFO, null);
        LedgerEntry first = dispatcher.maybeSendInApp(req).entry();
        LedgerEntry read = dispatcher.markRead(first.id());
        assertEquals(DeliveryStatus.READ, read.status());

        assertEquals(DeliveryOutcome.SKIPPED_DEDUPE_WINDOW, dispatcher.maybeSendInApp(req).outcome());
    }

    @Test
    void dedupeWindowShouldBeClamped() {
        assertEquals(24, LedgerDispatcher.clampWindow(null));
        assertEquals(1, LedgerDispatcher.clampWindow(0));
        assertEquals(168, LedgerDispatcher.clampWindow(500));

        NotificationRequest req = request("k1", Severity.INFO, 500);
        dispatcher.maybeSendInApp(req);
        clock.advance(Duration.ofHours(169));
        assertEquals(DeliveryOutcome.SENT, dispatcher.maybeSendInApp(req).outcome());
    }

    @Test
    void emailShouldDedupePerUtcDay() throws Exception {
        NotificationRequest req = request("daily", Severity.WARN, null);

        assertEquals(DeliveryOutcome.SENT, dispatcher.maybeSendEmail(req).outcome());
        clock.set(Instant.parse("2026-03-02T23:59:00Z"));
        DeliveryResult dup = dispatcher.maybeSendEmail(req);
        assertEquals(DeliveryOutcome.SKIPPED_DAILY_DEDUPE, dup.outcome());
        assertTrue(dup.outcome().isDedupeSkip());

        clock.set(Instant.parse("2026-03-03T00:01:00Z"));
        assertEquals(DeliveryOutcome.SENT, dispatcher.maybeSendEmail(req).outcome());
        verify(email, times(2)).send(any());
    }

    @Test
    void emailTransportErrorShouldBeRecordedAsFailedAndNotDedupe() throws Exception {
        when(email.send(any())).thenThrow(new IllegalStateException("smtp down"));
        NotificationRequest req = request("k-fail", Severity.INFO, null);

        DeliveryResult result = dispatcher.maybeSendEmail(req);
        assertEquals(DeliveryOutcome.FAILED, result.outcome());
        assertEquals("smtp down", result.reason());
        assertEquals(DeliveryStatus.FAILED, result.entry().status());
        assertEquals("smtp down", result.entry().error());
        assertNull(result.entry().sentAt());

        dispatcher.maybeSendEmail(req);
        verify(email, times(2)).send(any());
    }

    @Test
    void nullTransportResultShouldBeFailed() throws Exception {
        when(email.send(any())).thenReturn(null);
        DeliveryResult result = dispatcher.maybeSendEmail(request("k", Severity.INFO, null));
        assertEquals(DeliveryOutcome.FAILED, result.outcome());
        assertEquals("provider_returned_invalid_result", result.entry().error());
    }

    @Test
    void pushShouldBeDisabledByDefaultPreferences() {
        DeliveryResult result = dispatcher.maybeSendPush(request("p", Severity.CRITICAL, null));
        assertEquals(DeliveryOutcome.SKIPPED, result.outcome());
        assertEquals("channel_disabled_push", result.reason());
        assertEquals(DeliveryStatus.SKIPPED, result.entry().status());
    }

    @Test
    void pushWithoutProviderShouldBeSkippedEveryTime() {
        preference(new NotificationPreference("UTC", true, true, true, null, null, Severity.INFO, List.of()));
        NotificationRequest req = request("p", Severity.INFO, null);

        DeliveryResult first = dispatcher.maybeSendPush(req);
        DeliveryResult second = dispatcher.maybeSendPush(req);
        assertEquals(UnconfiguredPushSender.REASON, first.reason());
        assertEquals(DeliveryOutcome.SKIPPED, second.outcome());
        assertEquals(2, ledger.entries.size());
    }

    @Test
    void preferenceBlocksShouldRecordSkippedWithoutCallingTransport() throws Exception {
        preference(new NotificationPreference("UTC", true, false, false, null, null, Severity.INFO, List.of()));
        DeliveryResult disabled = dispatcher.maybeSendEmail(request("e", Severity.CRITICAL, null));
        assertEquals("channel_disabled_email", disabled.reason());
        verify(email, never()).send(any());

        preference(new NotificationPreference("UTC", true, true, false, null, null, Severity.WARN, List.of()));
        assertEquals("severity_below_preference",
                dispatcher.maybeSendInApp(request("i", Severity.INFO, null)).reason());

        preference(new NotificationPreference("UTC", true, true, false, null, null, Severity.INFO, List.of("y-2")));
        assertEquals("yacht_out_of_scope", dispatcher.maybeSendInApp(request("i2", Severity.INFO, null)).reason());

        preference(new NotificationPreference("UTC", true, true, false, "18:00", "20:00", Severity.INFO, List.of()));
        assertEquals("outside_delivery_window",
                dispatcher.maybeSendInApp(request("i3", Severity.INFO, null)).reason());

        assertTrue(ledger.entries.stream().allMatch(e -> e.status() == DeliveryStatus.SKIPPED));
    }

    @Test
    void deliveryWindowShouldSupportWrapAndZones() {
        NotificationPreference night = new NotificationPreference("UTC", true, true, false, "22:00", "06:00",
                Severity.INFO, List.of());
        assertTrue(LedgerDispatcher.withinDeliveryWindow(night, Instant.parse("2026-03-02T23:30:00Z")));
        assertTrue(LedgerDispatcher.withinDeliveryWindow(night, Instant.parse("2026-03-02T05:59:00Z")));
        assertFalse(LedgerDispatcher.withinDeliveryWindow(night, Instant.parse("2026-03-02T12:00:00Z")));

        NotificationPreference paris = new NotificationPreference("Europe/Paris", true, true, false, "09:00", "17:00",
                Severity.INFO, List.of());
        // 08:30Z is 09:30 in Paris (CET)
        assertTrue(LedgerDispatcher.withinDeliveryWindow(paris, Instant.parse("2026-03-02T08:30:00Z")));
        assertFalse(LedgerDispatcher.withinDeliveryWindow(paris, Instant.parse("2026-03-02T16:30:00Z")));

        NotificationPreference bogusZone = new NotificationPreference("Not/AZone", true, true, false, "09:00", "17:00",
                Severity.INFO, List.of());
        assertTrue(LedgerDispatcher.withinDeliveryWindow(bogusZone, Instant.parse("2026-03-02T10:00:00Z")));

        NotificationPreference sameBounds = new NotificationPreference("UTC", true, true, false, "10:00", "10:00",
                Severity.INFO, List.of());
        assertTrue(LedgerDispatcher.withinDeliveryWindow(sameBounds, Instant.parse("2026-03-02T03:00:00Z")));
    }

    @Test
    void listInAppShouldReturnNewestFirst() {
        dispatcher.maybeSendInApp(request("a", Severity.INFO, null));
        clock.advance(Duration.ofMinutes(1));
        dispatcher.maybeSendInApp(request("b", Severity.INFO, null));
        dispatcher.maybeSendEmail(request("c", Severity.INFO, null));

        List<LedgerEntry> inbox = dispatcher.listInApp("u1", 0);
        assertEquals(1, inbox.size());
        assertEquals("b", inbox.get(0).dedupeKey());
        assertEquals(2, dispatcher.listInApp("u1", 50).size());
    }

    @Test
    void markReadShouldFailForUnknownEntry() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> dispatcher.markRead("nope"));
        assertEquals("nope", e.id());
    }

    @Test
    void dispatchToRecipientsShouldCountSentAttempts() {
        int sent = dispatcher.dispatchToRecipients(List.of("u1", "u2"),
                List.of(NotificationChannel.IN_APP, NotificationChannel.EMAIL, NotificationChannel.PUSH),
                userId -> new NotificationRequest(userId, "y-1", "t", "key:" + userId, Severity.INFO, Map.of(), null));
        // push is disabled by default preferences
        assertEquals(4, sent);
        assertNotNull(ledger.entries.get(0).payload());
    }

    private void preference(NotificationPreference pref) {
        when(preferences.find("u1")).thenReturn(Optional.of(pref));
    }

    private static NotificationRequest request(String dedupeKey, Severity severity, Integer windowHours) {
        return new NotificationRequest("u1", "y-1", "maintenance.due_soon", dedupeKey, severity,
                Map.of("title", "Service"), windowHours);
    }
}
