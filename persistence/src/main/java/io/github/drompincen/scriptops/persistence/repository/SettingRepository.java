package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.document.SettingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SettingRepository extends MongoRepository<SettingDocument, String> {
}
