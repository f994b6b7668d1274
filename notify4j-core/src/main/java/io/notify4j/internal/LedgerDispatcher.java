package io.notify4j.internal;

import io.notify4j.ChannelSender;
import io.notify4j.NotificationDispatcher;
import io.notify4j.core.ChannelSendResult;
import io.notify4j.core.DeliveryOutcome;
import io.notify4j.core.DeliveryResult;
import io.notify4j.core.DeliveryStatus;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.NotFoundException;
import io.notify4j.core.NotificationChannel;
import io.notify4j.core.NotificationPreference;
import io.notify4j.core.NotificationRequest;
import io.notify4j.spi.NotificationLedger;
import io.notify4j.spi.PreferenceStore;
import io.notify4j.utils.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ledger-backed {@link NotificationDispatcher}.
 *
 * <p>Per channel:
 * <ul>
 *   <li>in-app: recorded as sent locally; skipped when a sent/read entry exists inside the dedupe window</li>
 *   <li>email: skipped when a sent entry exists since the start of the current UTC day</li>
 *   <li>push: no dedupe; outcome is whatever the push transport reports</li>
 * </ul>
 * A user preference that blocks the channel writes a {@code skipped} row and the transport is not called.
 */
public class LedgerDispatcher implements NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LedgerDispatcher.class);

    public static final int DEFAULT_DEDUPE_WINDOW_HOURS = 24;
    public static final int MAX_DEDUPE_WINDOW_HOURS = 24 * 7;

    private static final Set<DeliveryStatus> IN_APP_DEDUPE_STATUSES = EnumSet.of(DeliveryStatus.SENT, DeliveryStatus.READ);
    private static final Set<DeliveryStatus> EMAIL_DEDUPE_STATUSES = EnumSet.of(DeliveryStatus.SENT);
    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final NotificationLedger ledger;
    private final PreferenceStore preferences;
    private final ChannelSender emailSender;
    private final ChannelSender pushSender;
    private final Clock clock;

    public LedgerDispatcher(
            NotificationLedger ledger,
            PreferenceStore preferences,
            ChannelSender emailSender,
            ChannelSender pushSender,
            Clock clock
    ) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.preferences = preferences;
        this.emailSender = Objects.requireNonNull(emailSender, "emailSender must not be null");
        this.pushSender = Objects.requireNonNull(pushSender, "pushSender must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public DeliveryResult maybeSendInApp(NotificationRequest request) {
        Instant now = now();
        NotificationChannel channel = NotificationChannel.IN_APP;

        String blocked = blockReason(request, channel, now);
        if (blocked != null) {
            return recordSkipped(request, channel, blocked, now);
        }

        int windowHours = clampWindow(request.dedupeWindowHours());
        Instant since = now.minus(Duration.ofHours(windowHours));
        if (ledger.exists(request.userId(), channel, request.dedupeKey(), since, IN_APP_DEDUPE_STATUSES)) {
            log.debug("notify4j dedupe skip outcome={} channel={} userId={} dedupeKey={} windowHours={}",
                    DeliveryOutcome.SKIPPED_DEDUPE_WINDOW.value(), channel.value(), request.userId(),
                    request.dedupeKey(), windowHours);
            return new DeliveryResult(channel, DeliveryOutcome.SKIPPED_DEDUPE_WINDOW, "dedupe_window", null);
        }

        LedgerEntry entry = ledger.record(entry(request, channel, DeliveryStatus.SENT, now, now, null));
        return new DeliveryResult(channel, DeliveryOutcome.SENT, null, entry);
    }

    @Override
    public DeliveryResult maybeSendEmail(NotificationRequest request) {
        Instant now = now();
        NotificationChannel channel = NotificationChannel.EMAIL;

        String blocked = blockReason(request, channel, now);
        if (blocked != null) {
            return recordSkipped(request, channel, blocked, now);
        }

        Instant dayStart = TimeFormats.startOfUtcDay(now);
        if (ledger.exists(request.userId(), channel, request.dedupeKey(), dayStart, EMAIL_DEDUPE_STATUSES)) {
            log.debug("notify4j dedupe skip outcome={} channel={} userId={} dedupeKey={} since={}",
                    DeliveryOutcome.SKIPPED_DAILY_DEDUPE.value(), channel.value(), request.userId(),
                    request.dedupeKey(), TimeFormats.iso(dayStart));
            return new DeliveryResult(channel, DeliveryOutcome.SKIPPED_DAILY_DEDUPE, "daily_dedupe", null);
        }

        return deliver(request, channel, emailSender, now);
    }

    @Override
    public DeliveryResult maybeSendPush(NotificationRequest request) {
        Instant now = now();
        NotificationChannel channel = NotificationChannel.PUSH;

        String blocked = blockReason(request, channel, now);
        if (blocked != null) {
            return recordSkipped(request, channel, blocked, now);
        }
        return deliver(request, channel, pushSender, now);
    }

    @Override
    public List<LedgerEntry> listInApp(String userId, int limit) {
        Objects.requireNonNull(userId, "userId must not be null");
        int safeLimit = Math.min(Math.max(limit, 1), 200);
        return ledger.findByUser(userId, NotificationChannel.IN_APP, safeLimit);
    }

    @Override
    public LedgerEntry markRead(String entryId) {
        return ledger.markRead(entryId).orElseThrow(() -> new NotFoundException("notification", entryId));
    }

    private DeliveryResult deliver(NotificationRequest request, NotificationChannel channel, ChannelSender sender,
                                   Instant now) {
        ChannelSendResult result;
        try {
            result = sender.send(request);
            if (result == null) {
                result = ChannelSendResult.failed("provider_returned_invalid_result");
            }
        } catch (Exception e) {
            result = ChannelSendResult.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }

        DeliveryStatus status = result.status();
        LedgerEntry entry = ledger.record(entry(request, channel, status,
                now, status == DeliveryStatus.SENT ? now : null, result.detail()));

        switch (status) {
            case SENT:
                return new DeliveryResult(channel, DeliveryOutcome.SENT, null, entry);
            case FAILED:
                log.warn("notify4j transport failed channel={} userId={} dedupeKey={} error={}",
                        channel.value(), request.userId(), request.dedupeKey(), result.detail());
                return new DeliveryResult(channel, DeliveryOutcome.FAILED, result.detail(), entry);
            default:
                log.debug("notify4j transport skipped channel={} userId={} reason={}",
                        channel.value(), request.userId(), result.detail());
                return new DeliveryResult(channel, DeliveryOutcome.SKIPPED, result.detail(), entry);
        }
    }

    private DeliveryResult recordSkipped(NotificationRequest request, NotificationChannel channel, String reason,
                                         Instant now) {
        log.debug("notify4j preference skip channel={} userId={} reason={}", channel.value(), request.userId(), reason);
        LedgerEntry entry = ledger.record(entry(request, channel, DeliveryStatus.SKIPPED, now, null, reason));
        return new DeliveryResult(channel, DeliveryOutcome.SKIPPED, reason, entry);
    }

    private String blockReason(NotificationRequest request, NotificationChannel channel, Instant now) {
        NotificationPreference pref = preferences == null
                ? NotificationPreference.defaults()
                : preferences.find(request.userId()).orElseGet(NotificationPreference::defaults);

        if (!pref.isEnabled(channel)) {
            return "channel_disabled_" + channel.value();
        }
        if (!request.severity().isAtLeast(pref.minSeverity())) {
            return "severity_below_preference";
        }
        if (!pref.yachtsScope().isEmpty() && request.yachtId() != null && !pref.yachtsScope().contains(request.yachtId())) {
            return "yacht_out_of_scope";
        }
        if (!withinDeliveryWindow(pref, now)) {
            return "outside_delivery_window";
        }
        return null;
    }

    static boolean withinDeliveryWindow(NotificationPreference pref, Instant now) {
        Integer start = minutesOf(pref.windowStart());
        Integer end = minutesOf(pref.windowEnd());
        if (start == null || end == null || start.equals(end)) {
            return true;
        }

        ZoneId zone;
        try {
            zone = ZoneId.of(pref.timezone());
        } catch (DateTimeException e) {
            zone = ZoneOffset.UTC;
        }
        LocalTime local = now.atZone(zone).toLocalTime();
        int current = local.getHour() * 60 + local.getMinute();

        if (start < end) {
            return current >= start && current <= end;
        }
        // window wraps midnight
        return current >= start || current <= end;
    }

    private static Integer minutesOf(String hhmm) {
        if (hhmm == null) {
            return null;
        }
        Matcher m = HH_MM.matcher(hhmm.trim());
        if (!m.matches()) {
            return null;
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = Integer.parseInt(m.group(2));
        if (hours > 23 || minutes > 59) {
            return null;
        }
        return hours * 60 + minutes;
    }

    static int clampWindow(Integer hours) {
        int h = hours == null ? DEFAULT_DEDUPE_WINDOW_HOURS : hours;
        return Math.max(1, Math.min(h, MAX_DEDUPE_WINDOW_HOURS));
    }

    private static LedgerEntry entry(NotificationRequest request, NotificationChannel channel, DeliveryStatus status,
                                     Instant createdAt, Instant sentAt, String error) {
        return new LedgerEntry(null, request.userId(), request.yachtId(), channel, request.type(),
                request.dedupeKey(), status, request.payload(), createdAt, sentAt, error);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
