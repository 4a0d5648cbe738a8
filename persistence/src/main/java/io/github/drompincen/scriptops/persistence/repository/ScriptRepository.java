package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.document.ScriptDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ScriptRepository extends MongoRepository<ScriptDocument, String> {
}
