package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.lookup.SettingsLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fails executions that have been RUNNING longer than the {@code EXECUTION_TIMEOUT} setting
 * (minutes) and kills their process if it is still registered. The periodic trigger lives
 * outside this class.
 */
@Service
public class HungExecutionReaper {

    private static final Logger log = LoggerFactory.getLogger(HungExecutionReaper.class);
    static final int DEFAULT_TIMEOUT_MINUTES = 30;

    private final ExecutionLedger ledger;
    private final SettingsLookup settings;
    private final ProcessRegistry processRegistry;
    private final ExecutionEventPublisher events;
    private final ScriptOpsProperties properties;

    public HungExecutionReaper(ExecutionLedger ledger,
                               SettingsLookup settings,
                               ProcessRegistry processRegistry,
                               ExecutionEventPublisher events,
                               ScriptOpsProperties properties) {
        this.ledger = ledger;
        this.settings = settings;
        this.processRegistry = processRegistry;
        this.events = events;
        this.properties = properties;
    }

    /** Returns the number of executions marked failed by this sweep. */
    public int checkHungExecutions() {
        int timeoutMinutes = timeoutMinutes();
        Instant threshold = Instant.now().minus(Duration.ofMinutes(timeoutMinutes));
        List<ExecutionDocument> candidates = ledger.findRunningStartedBefore(threshold);

        int reaped = 0;
        for (ExecutionDocument candidate : candidates) {
            String executionId = candidate.getExecutionId();
            try {
                if (!ledger.failIfStale(executionId, threshold, ExecutionBanners.TIMED_OUT)) {
                    continue;
                }
                reaped++;
                events.publishOutput(executionId, ExecutionBanners.TIMED_OUT);
                events.publishStatus(executionId, ExecutionStatus.FAILED);
                log.warn("Execution {} exceeded the {} minute timeout and was marked failed",
                        executionId, timeoutMinutes);
                if (processRegistry.terminate(executionId, properties.getExecution().getKillGrace())) {
                    log.info("Terminated process of hung execution {}", executionId);
                }
            } catch (Exception e) {
                log.error("Failed to reap execution {}", executionId, e);
            }
        }
        if (reaped > 0) {
            log.info("Hung execution sweep failed {} execution(s)", reaped);
        }
        return reaped;
    }

    int timeoutMinutes() {
        String raw = settings.get(SettingsLookup.EXECUTION_TIMEOUT, String.valueOf(DEFAULT_TIMEOUT_MINUTES));
        if (raw != null) {
            try {
                int minutes = Integer.parseInt(raw.trim());
                if (minutes > 0) return minutes;
            } catch (NumberFormatException e) {
                log.debug("{} is not a number: {}", SettingsLookup.EXECUTION_TIMEOUT, e.getMessage());
            }
        }
        log.warn("Invalid {} setting '{}', using {} minutes",
                SettingsLookup.EXECUTION_TIMEOUT, raw, DEFAULT_TIMEOUT_MINUTES);
        return DEFAULT_TIMEOUT_MINUTES;
    }
}
