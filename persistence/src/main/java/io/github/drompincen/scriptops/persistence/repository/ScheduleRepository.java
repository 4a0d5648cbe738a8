package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.document.ScheduleDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import java.time.Instant;
import java.util.List;

public interface ScheduleRepository extends MongoRepository<ScheduleDocument, String> {
    List<ScheduleDocument> findByEnabled(boolean enabled);
    List<ScheduleDocument> findAllByOrderByCreatedAtDesc();
    List<ScheduleDocument> findByEnabledOrderByCreatedAtDesc(boolean enabled);

    /** Touches only the run timestamps, so a concurrent edit of the row is never overwritten. */
    @Query("{ '_id' : ?0 }")
    @Update("{ '$set' : { 'lastRun' : ?1, 'nextRun' : ?2 } }")
    long updateRunTimes(String scheduleId, Instant lastRun, Instant nextRun);

    @Query("{ '_id' : ?0 }")
    @Update("{ '$set' : { 'lastRun' : ?1 } }")
    long updateLastRun(String scheduleId, Instant lastRun);
}
