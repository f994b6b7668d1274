package io.notify4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.core.DeliveryStatus;
import io.notify4j.core.LedgerEntry;
import io.notify4j.core.NotificationChannel;
import io.notify4j.spi.NotificationLedger;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static io.notify4j.internal.mongo.MongoValues.enumValue;
import static io.notify4j.internal.mongo.MongoValues.plainMap;
import static io.notify4j.internal.mongo.MongoValues.value;

/**
 * MongoDB notification ledger ({@code notification_events}).
 */
public class MongoNotificationLedger implements NotificationLedger {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoNotificationLedger(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean exists(String userId, NotificationChannel channel, String dedupeKey, Instant since,
                          Collection<DeliveryStatus> statuses) {
        List<String> statusValues = new ArrayList<>(statuses.size());
        for (DeliveryStatus s : statuses) {
            statusValues.add(value(s));
        }
        Query q = new Query(Criteria.where("userId").is(userId)
                .and("channel").is(value(channel))
                .and("dedupeKey").is(dedupeKey)
                .and("createdAt").gte(since)
                .and("status").in(statusValues));
        return mongoTemplate.exists(q, NotificationEventDocument.class);
    }

    @Override
    public LedgerEntry record(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        NotificationEventDocument doc = new NotificationEventDocument();
        doc.setUserId(entry.userId());
        doc.setYachtId(entry.yachtId());
        doc.setChannel(value(entry.channel()));
        doc.setType(entry.type());
        doc.setDedupeKey(entry.dedupeKey());
        doc.setStatus(value(entry.status()));
        doc.setPayload(plainMap(objectMapper, entry.payload()));
        doc.setCreatedAt(entry.createdAt());
        doc.setSentAt(entry.sentAt());
        doc.setError(entry.error());
        return toEntry(mongoTemplate.insert(doc));
    }

    @Override
    public List<LedgerEntry> findByUser(String userId, NotificationChannel channel, int limit) {
        Query q = new Query(Criteria.where("userId").is(userId).and("channel").is(value(channel)))
                .with(Sort.by(Sort.Order.desc("createdAt")))
                .limit(limit);
        List<NotificationEventDocument> docs = mongoTemplate.find(q, NotificationEventDocument.class);
        List<LedgerEntry> out = new ArrayList<>(docs.size());
        for (NotificationEventDocument d : docs) {
            out.add(toEntry(d));
        }
        return out;
    }

    @Override
    public Optional<LedgerEntry> markRead(String entryId) {
        Objects.requireNonNull(entryId, "entryId must not be null");
        Update u = new Update()
                .set("status", value(DeliveryStatus.READ))
                .set("readAt", clock.instant());
        NotificationEventDocument doc = mongoTemplate.findAndModify(
                new Query(Criteria.where("_id").is(entryId)), u,
                FindAndModifyOptions.options().returnNew(true), NotificationEventDocument.class);
        return Optional.ofNullable(doc).map(this::toEntry);
    }

    private LedgerEntry toEntry(NotificationEventDocument doc) {
        return new LedgerEntry(
                doc.getId(),
                doc.getUserId(),
                doc.getYachtId(),
                enumValue(NotificationChannel.class, doc.getChannel()),
                doc.getType(),
                doc.getDedupeKey(),
                enumValue(DeliveryStatus.class, doc.getStatus()),
                doc.getPayload(),
                doc.getCreatedAt(),
                doc.getSentAt(),
                doc.getError()
        );
    }
}
