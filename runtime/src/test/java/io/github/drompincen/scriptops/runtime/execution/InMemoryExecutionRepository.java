package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.persistence.repository.ExecutionRepository;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Mocked {@link ExecutionRepository} backed by a map. Rows are copied on save and on read, like
 * a real store, so callers never share a mutable document.
 */
final class InMemoryExecutionRepository {

    private final Map<String, ExecutionDocument> rows = new ConcurrentHashMap<>();
    private final ExecutionRepository repository = mock(ExecutionRepository.class);

    InMemoryExecutionRepository() {
        when(repository.save(any(ExecutionDocument.class))).thenAnswer(inv -> {
            ExecutionDocument doc = inv.getArgument(0);
            rows.put(doc.getExecutionId(), copy(doc));
            return doc;
        });
        when(repository.findById(anyString())).thenAnswer(inv ->
                Optional.ofNullable(rows.get(inv.<String>getArgument(0))).map(InMemoryExecutionRepository::copy));
        when(repository.findByStatusAndStartTimeBefore(any(), any())).thenAnswer(inv -> {
            ExecutionStatus status = inv.getArgument(0);
            Instant threshold = inv.getArgument(1);
            return rows.values().stream()
                    .filter(d -> d.getStatus() == status && d.getStartTime().isBefore(threshold))
                    .map(InMemoryExecutionRepository::copy)
                    .collect(Collectors.toList());
        });
    }

    ExecutionRepository repository() {
        return repository;
    }

    void put(ExecutionDocument doc) {
        rows.put(doc.getExecutionId(), copy(doc));
    }

    ExecutionDocument row(String executionId) {
        return rows.get(executionId);
    }

    static ExecutionDocument copy(ExecutionDocument src) {
        ExecutionDocument doc = new ExecutionDocument();
        doc.setExecutionId(src.getExecutionId());
        doc.setScriptId(src.getScriptId());
        doc.setProfileId(src.getProfileId());
        doc.setUserId(src.getUserId());
        doc.setStatus(src.getStatus());
        doc.setStartTime(src.getStartTime());
        doc.setEndTime(src.getEndTime());
        doc.setOutput(src.getOutput());
        doc.setParameters(src.getParameters() != null ? new LinkedHashMap<>(src.getParameters()) : null);
        doc.setRegionOverride(src.getRegionOverride());
        doc.setScheduled(src.isScheduled());
        doc.setScheduleId(src.getScheduleId());
        doc.setAiAnalysis(src.getAiAnalysis());
        doc.setAiSolution(src.getAiSolution());
        doc.setCreatedAt(src.getCreatedAt());
        return doc;
    }
}
