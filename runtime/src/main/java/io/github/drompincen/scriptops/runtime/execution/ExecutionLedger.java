package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.persistence.repository.ExecutionRepository;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.error.ExecutionNotFoundException;
import io.github.drompincen.scriptops.runtime.error.ExecutionNotRunningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns every write to the {@code executions} collection. Mutations of one row are serialized
 * through a striped lock, so status flips and output appends never interleave for the same id.
 * Status only moves forward: PENDING, RUNNING, then one terminal state that is never left.
 */
@Service
public class ExecutionLedger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);
    private static final int LOCK_STRIPES = 64;

    private final ExecutionRepository executionRepository;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public ExecutionLedger(ExecutionRepository executionRepository) {
        this.executionRepository = executionRepository;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public ExecutionDocument create(StartExecutionCommand command) {
        Instant now = Instant.now();
        ExecutionDocument doc = new ExecutionDocument();
        doc.setExecutionId(UUID.randomUUID().toString());
        doc.setScriptId(command.scriptId());
        doc.setProfileId(command.profileId());
        doc.setUserId(command.userId());
        doc.setStatus(ExecutionStatus.PENDING);
        doc.setStartTime(now);
        doc.setOutput("");
        doc.setParameters(command.parameters());
        doc.setRegionOverride(command.regionOverride());
        doc.setScheduled(command.isScheduled());
        doc.setScheduleId(command.scheduleId());
        doc.setCreatedAt(now);
        return executionRepository.save(doc);
    }

    public Optional<ExecutionDocument> find(String executionId) {
        return executionRepository.findById(executionId);
    }

    public ExecutionDocument get(String executionId) {
        return find(executionId).orElseThrow(() -> new ExecutionNotFoundException(executionId));
    }

    public ExecutionStatus statusOf(String executionId) {
        return get(executionId).getStatus();
    }

    /** PENDING to RUNNING. Returns false and leaves the row alone from any other state. */
    public boolean markRunning(String executionId) {
        return withLock(executionId, () -> {
            ExecutionDocument doc = get(executionId);
            if (doc.getStatus() != ExecutionStatus.PENDING) {
                return false;
            }
            doc.setStatus(ExecutionStatus.RUNNING);
            executionRepository.save(doc);
            return true;
        });
    }

    /** Appends to the output of a row in any state. */
    public void append(String executionId, String text) {
        if (text == null || text.isEmpty()) return;
        withLock(executionId, () -> {
            Optional<ExecutionDocument> found = find(executionId);
            if (found.isEmpty()) {
                log.warn("Dropping output for unknown execution {}", executionId);
                return null;
            }
            ExecutionDocument doc = found.get();
            doc.setOutput(doc.getOutput() == null ? text : doc.getOutput() + text);
            executionRepository.save(doc);
            return null;
        });
    }

    /**
     * Moves a non-terminal row to {@code status}, appending {@code banner} and stamping the end
     * time. Returns false without touching the row when it is already terminal.
     */
    public boolean finish(String executionId, ExecutionStatus status, String banner) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        return withLock(executionId, () -> {
            ExecutionDocument doc = get(executionId);
            if (doc.getStatus().isTerminal()) {
                log.debug("Execution {} already {}, ignoring transition to {}",
                        executionId, doc.getStatus(), status);
                return false;
            }
            terminate(doc, status, banner);
            return true;
        });
    }

    /**
     * RUNNING to CANCELLED. Any other state fails with {@link ExecutionNotRunningException} and
     * no write.
     */
    public void cancel(String executionId, String banner) {
        withLock(executionId, () -> {
            ExecutionDocument doc = get(executionId);
            if (doc.getStatus() != ExecutionStatus.RUNNING) {
                throw new ExecutionNotRunningException(executionId, doc.getStatus());
            }
            terminate(doc, ExecutionStatus.CANCELLED, banner);
            return null;
        });
    }

    /** Fails a row that is still RUNNING and started before {@code threshold}. */
    public boolean failIfStale(String executionId, Instant threshold, String banner) {
        return withLock(executionId, () -> {
            Optional<ExecutionDocument> found = find(executionId);
            if (found.isEmpty()) return false;
            ExecutionDocument doc = found.get();
            if (doc.getStatus() != ExecutionStatus.RUNNING
                    || doc.getStartTime() == null
                    || !doc.getStartTime().isBefore(threshold)) {
                return false;
            }
            terminate(doc, ExecutionStatus.FAILED, banner);
            return true;
        });
    }

    public List<ExecutionDocument> findRunningStartedBefore(Instant threshold) {
        return executionRepository.findByStatusAndStartTimeBefore(ExecutionStatus.RUNNING, threshold);
    }

    public void saveAiHelp(String executionId, String analysis, String solution) {
        withLock(executionId, () -> {
            ExecutionDocument doc = get(executionId);
            doc.setAiAnalysis(analysis);
            doc.setAiSolution(solution);
            executionRepository.save(doc);
            return null;
        });
    }

    private void terminate(ExecutionDocument doc, ExecutionStatus status, String banner) {
        doc.setStatus(status);
        doc.setEndTime(Instant.now());
        if (banner != null) {
            doc.setOutput(doc.getOutput() == null ? banner : doc.getOutput() + banner);
        }
        executionRepository.save(doc);
    }

    private <T> T withLock(String executionId, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(executionId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
