package io.notify4j.internal.mongo;

import io.notify4j.core.Alert;
import io.notify4j.core.AlertUpsert;
import io.notify4j.core.Severity;
import io.notify4j.spi.AlertStore;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB alert store ({@code alerts}), upserted by dedupe key.
 */
public class MongoAlertStore implements AlertStore {

    private final MongoTemplate mongoTemplate;

    public MongoAlertStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Single {@code findAndModify} upsert: identity fields are only written on insert.
     */
    @Override
    public Alert upsert(AlertUpsert upsert, Instant now) {
        Objects.requireNonNull(upsert, "upsert must not be null");

        Update u = new Update()
                .set("severity", upsert.severity() == null ? Severity.INFO.value() : upsert.severity().value())
                .set("dueAt", upsert.dueAt())
                .set("assignedTo", upsert.assignedTo())
                .set("updatedAt", now)
                .setOnInsert("yachtId", upsert.yachtId())
                .setOnInsert("module", upsert.module())
                .setOnInsert("alertType", upsert.alertType())
                .setOnInsert("entityId", upsert.entityId())
                .setOnInsert("createdAt", now);

        AlertDocument doc = mongoTemplate.findAndModify(byDedupeKey(upsert.dedupeKey()), u,
                FindAndModifyOptions.options().upsert(true).returnNew(true), AlertDocument.class);
        return toAlert(Objects.requireNonNull(doc, "upsert returned no document"));
    }

    @Override
    public Optional<Alert> resolve(String dedupeKey, Instant at) {
        Update u = new Update().set("resolvedAt", at).set("updatedAt", at);
        AlertDocument doc = mongoTemplate.findAndModify(byDedupeKey(dedupeKey), u,
                FindAndModifyOptions.options().returnNew(true), AlertDocument.class);
        return Optional.ofNullable(doc).map(MongoAlertStore::toAlert);
    }

    @Override
    public Optional<Alert> findByDedupeKey(String dedupeKey) {
        return Optional.ofNullable(mongoTemplate.findOne(byDedupeKey(dedupeKey), AlertDocument.class))
                .map(MongoAlertStore::toAlert);
    }

    private static Query byDedupeKey(String dedupeKey) {
        Objects.requireNonNull(dedupeKey, "dedupeKey must not be null");
        return new Query(Criteria.where("dedupeKey").is(dedupeKey));
    }

    private static Alert toAlert(AlertDocument doc) {
        return new Alert(
                doc.getId(),
                doc.getYachtId(),
                doc.getModule(),
                doc.getAlertType(),
                Severity.normalize(doc.getSeverity()),
                doc.getDedupeKey(),
                doc.getEntityId(),
                doc.getAssignedTo(),
                doc.getDueAt(),
                doc.getCreatedAt(),
                doc.getResolvedAt()
        );
    }
}
