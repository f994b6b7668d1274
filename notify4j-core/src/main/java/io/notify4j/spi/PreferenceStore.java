package io.notify4j.spi;

import io.notify4j.core.NotificationPreference;

import java.util.Optional;

/**
 * Per-user delivery preferences. Users without a stored row get {@link NotificationPreference#defaults()}.
 */
public interface PreferenceStore {

    Optional<NotificationPreference> find(String userId);

    NotificationPreference save(String userId, NotificationPreference preference);
}
