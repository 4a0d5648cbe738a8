package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface ExecutionRepository extends MongoRepository<ExecutionDocument, String> {
    List<ExecutionDocument> findByStatusAndStartTimeBefore(ExecutionStatus status, Instant threshold);
    List<ExecutionDocument> findAllByOrderByStartTimeDesc(Pageable pageable);
    List<ExecutionDocument> findByStartTimeGreaterThanEqual(Instant since);
}
