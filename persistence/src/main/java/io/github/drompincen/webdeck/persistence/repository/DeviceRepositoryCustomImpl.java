package io.github.drompincen.webdeck.persistence.repository;

import io.github.drompincen.webdeck.persistence.document.DeviceDocument;
import io.github.drompincen.webdeck.protocol.api.DeviceStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Optional;

public class DeviceRepositoryCustomImpl implements DeviceRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public DeviceRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<DeviceDocument> consumeVerificationCode(String deviceId) {
        Query query = new Query()
                .addCriteria(Criteria.where("deviceId").is(deviceId))
                .addCriteria(Criteria.where("status").is(DeviceStatus.PENDING))
                .addCriteria(Criteria.where("verificationCode").ne(null));
        Update update = new Update().unset("verificationCode").unset("codeExpiresAt");
        DeviceDocument before = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(false), DeviceDocument.class);
        return Optional.ofNullable(before);
    }

    @Override
    public boolean approve(String deviceId, String authToken, Instant tokenExpiresAt, Instant now) {
        Update update = new Update()
                .set("status", DeviceStatus.APPROVED)
                .set("authToken", authToken)
                .set("expiresAt", tokenExpiresAt)
                .set("lastActiveAt", now);
        return mongoTemplate.updateFirst(pending(deviceId), update, DeviceDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean resolvePending(String deviceId, DeviceStatus status) {
        Update update = new Update().set("status", status).unset("verificationCode");
        return mongoTemplate.updateFirst(pending(deviceId), update, DeviceDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean touchIfActive(String deviceId, String authToken, Instant now) {
        Query query = new Query()
                .addCriteria(Criteria.where("deviceId").is(deviceId))
                .addCriteria(Criteria.where("status").is(DeviceStatus.APPROVED))
                .addCriteria(Criteria.where("authToken").is(authToken))
                .addCriteria(Criteria.where("expiresAt").gt(now));
        return mongoTemplate.updateFirst(query, new Update().set("lastActiveAt", now), DeviceDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean revoke(String deviceId) {
        Query query = new Query().addCriteria(Criteria.where("deviceId").is(deviceId));
        Update update = new Update()
                .set("status", DeviceStatus.REJECTED)
                .unset("authToken")
                .unset("verificationCode")
                .unset("codeExpiresAt");
        return mongoTemplate.updateFirst(query, update, DeviceDocument.class).getMatchedCount() > 0;
    }

    @Override
    public long expireStalePending(Instant now) {
        Query query = new Query()
                .addCriteria(Criteria.where("status").is(DeviceStatus.PENDING))
                .addCriteria(Criteria.where("expiresAt").lt(now));
        Update update = new Update()
                .set("status", DeviceStatus.EXPIRED)
                .unset("verificationCode")
                .unset("codeExpiresAt");
        return mongoTemplate.updateMulti(query, update, DeviceDocument.class).getModifiedCount();
    }

    private Query pending(String deviceId) {
        return new Query()
                .addCriteria(Criteria.where("deviceId").is(deviceId))
                .addCriteria(Criteria.where("status").is(DeviceStatus.PENDING));
    }
}
