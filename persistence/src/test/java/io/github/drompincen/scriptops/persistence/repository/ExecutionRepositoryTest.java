package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionRepositoryTest extends AbstractMongoIntegrationTest {

    private static final Instant THRESHOLD = Instant.parse("2026-05-01T12:00:00Z");

    @Autowired
    private ExecutionRepository executionRepository;

    @Test
    void findByStatusAndStartTimeBefore_returnsOnlyRunningOlderThanThreshold() {
        executionRepository.save(createExecution("e1", "s1", ExecutionStatus.RUNNING, THRESHOLD.minusSeconds(3600)));
        executionRepository.save(createExecution("e2", "s1", ExecutionStatus.RUNNING, THRESHOLD.plusSeconds(60)));
        executionRepository.save(createExecution("e3", "s1", ExecutionStatus.SUCCESS, THRESHOLD.minusSeconds(3600)));
        executionRepository.save(createExecution("e4", "s1", ExecutionStatus.FAILED, THRESHOLD.minusSeconds(7200)));

        List<ExecutionDocument> result =
                executionRepository.findByStatusAndStartTimeBefore(ExecutionStatus.RUNNING, THRESHOLD);
        assertThat(result).extracting(ExecutionDocument::getExecutionId).containsExactly("e1");
    }

    @Test
    void findByStatusAndStartTimeBefore_excludesStartExactlyAtThreshold() {
        executionRepository.save(createExecution("e1", "s1", ExecutionStatus.RUNNING, THRESHOLD));

        assertThat(executionRepository.findByStatusAndStartTimeBefore(ExecutionStatus.RUNNING, THRESHOLD)).isEmpty();
    }

    @Test
    void findAllByOrderByStartTimeDesc_pagesNewestFirst() {
        executionRepository.save(createExecution("e1", "s1", ExecutionStatus.SUCCESS, THRESHOLD.minusSeconds(300)));
        executionRepository.save(createExecution("e2", "s1", ExecutionStatus.SUCCESS, THRESHOLD.minusSeconds(100)));
        executionRepository.save(createExecution("e3", "s2", ExecutionStatus.FAILED, THRESHOLD.minusSeconds(200)));

        List<ExecutionDocument> result = executionRepository.findAllByOrderByStartTimeDesc(PageRequest.of(0, 2));
        assertThat(result).extracting(ExecutionDocument::getExecutionId).containsExactly("e2", "e3");
    }

    @Test
    void findByStartTimeGreaterThanEqual_includesBoundary() {
        executionRepository.save(createExecution("e1", "s1", ExecutionStatus.SUCCESS, THRESHOLD.minusMillis(1)));
        executionRepository.save(createExecution("e2", "s1", ExecutionStatus.SUCCESS, THRESHOLD));
        executionRepository.save(createExecution("e3", "s1", ExecutionStatus.CANCELLED, THRESHOLD.plusSeconds(30)));

        List<ExecutionDocument> result = executionRepository.findByStartTimeGreaterThanEqual(THRESHOLD);
        assertThat(result).extracting(ExecutionDocument::getExecutionId).containsExactlyInAnyOrder("e2", "e3");
    }

    private ExecutionDocument createExecution(String id, String scriptId, ExecutionStatus status, Instant startTime) {
        ExecutionDocument doc = new ExecutionDocument();
        doc.setExecutionId(id);
        doc.setScriptId(scriptId);
        doc.setUserId("u1");
        doc.setStatus(status);
        doc.setStartTime(startTime);
        doc.setOutput("");
        doc.setCreatedAt(startTime);
        return doc;
    }
}
