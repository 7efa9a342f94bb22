package io.github.drompincen.webdeck.persistence.repository;

import io.github.drompincen.webdeck.persistence.document.DeviceDocument;
import io.github.drompincen.webdeck.protocol.api.DeviceStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeviceRepository extends MongoRepository<DeviceDocument, String>, DeviceRepositoryCustom {
    List<DeviceDocument> findAllByOrderByCreatedAtDesc();
    List<DeviceDocument> findByStatus(DeviceStatus status);
}
