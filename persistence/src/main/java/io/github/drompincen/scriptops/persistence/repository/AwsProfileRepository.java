package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.document.AwsProfileDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface AwsProfileRepository extends MongoRepository<AwsProfileDocument, String> {
}
