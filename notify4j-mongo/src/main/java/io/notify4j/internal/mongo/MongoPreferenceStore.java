package io.notify4j.internal.mongo;

import io.notify4j.core.NotificationPreference;
import io.notify4j.core.Severity;
import io.notify4j.spi.PreferenceStore;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB preference store ({@code notification_preferences}), one document per user.
 */
public class MongoPreferenceStore implements PreferenceStore {

    private final MongoTemplate mongoTemplate;

    public MongoPreferenceStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<NotificationPreference> find(String userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        NotificationPreferenceDocument doc = mongoTemplate.findById(userId, NotificationPreferenceDocument.class);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new NotificationPreference(
                doc.getTimezone(),
                doc.isInAppEnabled(),
                doc.isEmailEnabled(),
                doc.isPushEnabled(),
                doc.getWindowStart(),
                doc.getWindowEnd(),
                Severity.normalize(doc.getMinSeverity()),
                doc.getYachtsScope()
        ));
    }

    @Override
    public NotificationPreference save(String userId, NotificationPreference preference) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(preference, "preference must not be null");

        NotificationPreferenceDocument doc = new NotificationPreferenceDocument();
        doc.setId(userId);
        doc.setTimezone(preference.timezone());
        doc.setInAppEnabled(preference.inAppEnabled());
        doc.setEmailEnabled(preference.emailEnabled());
        doc.setPushEnabled(preference.pushEnabled());
        doc.setWindowStart(preference.windowStart());
        doc.setWindowEnd(preference.windowEnd());
        doc.setMinSeverity(preference.minSeverity().value());
        doc.setYachtsScope(new ArrayList<>(preference.yachtsScope()));
        mongoTemplate.save(doc);
        return preference;
    }
}
