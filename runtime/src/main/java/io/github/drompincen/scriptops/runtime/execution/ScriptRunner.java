package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.ProfileNotFoundException;
import io.github.drompincen.scriptops.runtime.error.ScriptNotFoundException;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfile;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfileLookup;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import io.github.drompincen.scriptops.runtime.lookup.ScriptLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts scripts as OS processes and drives each one to a terminal ledger state on its own
 * worker thread. Callers get the execution id back as soon as the PENDING row exists.
 */
@Service
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    private final ExecutionLedger ledger;
    private final ScriptLookup scriptLookup;
    private final CredentialProfileLookup profileLookup;
    private final ProcessLauncher launcher;
    private final ProcessRegistry processRegistry;
    private final InteractiveInputChannel inputChannel;
    private final ExecutionEventPublisher events;
    private final ApplicationEventPublisher applicationEvents;
    private final ScriptOpsProperties properties;
    private final Clock clock = Clock.systemUTC();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "script-exec-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public ScriptRunner(ExecutionLedger ledger,
                        ScriptLookup scriptLookup,
                        CredentialProfileLookup profileLookup,
                        ProcessLauncher launcher,
                        ProcessRegistry processRegistry,
                        InteractiveInputChannel inputChannel,
                        ExecutionEventPublisher events,
                        ApplicationEventPublisher applicationEvents,
                        ScriptOpsProperties properties) {
        this.ledger = ledger;
        this.scriptLookup = scriptLookup;
        this.profileLookup = profileLookup;
        this.launcher = launcher;
        this.processRegistry = processRegistry;
        this.inputChannel = inputChannel;
        this.events = events;
        this.applicationEvents = applicationEvents;
        this.properties = properties;
    }

    /**
     * Creates a PENDING execution and hands the process work to a background worker.
     *
     * @throws ScriptNotFoundException  when the script does not resolve
     * @throws ProfileNotFoundException when the credential profile does not resolve
     */
    public String start(StartExecutionCommand command) {
        ScriptInfo script = scriptLookup.findScript(command.scriptId())
                .orElseThrow(() -> new ScriptNotFoundException(command.scriptId()));
        CredentialProfile profile = profileLookup.findProfile(command.profileId())
                .orElseThrow(() -> new ProfileNotFoundException(command.profileId()));

        String executionId = ledger.create(command).getExecutionId();
        log.info("Execution {} created for script {} (scheduled={})",
                executionId, script.name(), command.isScheduled());
        executor.submit(() -> execute(executionId, command, script, profile));
        return executionId;
    }

    /**
     * Cancels a RUNNING execution. The ledger flips to CANCELLED before the process tree is
     * torn down, so a failed teardown never leaves the row running.
     */
    public void cancel(String executionId) {
        ledger.cancel(executionId, ExecutionBanners.CANCEL_REQUESTED);
        events.publishOutput(executionId, ExecutionBanners.CANCEL_REQUESTED);
        events.publishStatus(executionId, ExecutionStatus.CANCELLED);
        log.info("Execution {} cancelled by user, terminating process", executionId);

        try {
            processRegistry.terminate(executionId, properties.getExecution().getKillGrace());
            appendAndPublish(executionId, ExecutionBanners.PROCESS_TERMINATED);
        } catch (RuntimeException e) {
            log.error("Failed to terminate process of execution {}", executionId, e);
        }
    }

    public void provideInput(String executionId, String text) {
        inputChannel.provideInput(executionId, text);
    }

    void execute(String executionId, StartExecutionCommand command, ScriptInfo script, CredentialProfile profile) {
        try {
            if (!ledger.markRunning(executionId)) {
                log.warn("Execution {} is no longer pending, not starting it", executionId);
                return;
            }
            events.publishStatus(executionId, ExecutionStatus.RUNNING);
            appendAndPublish(executionId, ExecutionBanners.STARTING);

            ExecutionMailbox mailbox = inputChannel.open(executionId);
            Process process = launcher.launch(script, profile, command.regionOverride(), command.parameters());
            processRegistry.register(executionId, process);
            if (ledger.statusOf(executionId) == ExecutionStatus.CANCELLED) {
                // cancelled before the handle was registered
                processRegistry.terminate(executionId, properties.getExecution().getKillGrace());
            }

            executor.submit(() -> pumpOutput(executionId, process, mailbox));
            stream(executionId, process, mailbox);
            int exitCode = process.waitFor();
            complete(executionId, command, exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution {} interrupted", executionId);
            recordFailure(executionId, e);
        } catch (Exception e) {
            log.error("Execution {} failed: {}", executionId, e.getMessage(), e);
            recordFailure(executionId, e);
        } finally {
            processRegistry.unregister(executionId);
            inputChannel.close(executionId);
        }
    }

    private void pumpOutput(String executionId, Process process, ExecutionMailbox mailbox) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            StringBuilder line = new StringBuilder();
            int c;
            while ((c = reader.read()) != -1) {
                line.append((char) c);
                if (c == '\n') {
                    mailbox.postOutput(line.toString());
                    line.setLength(0);
                }
            }
            if (line.length() > 0) {
                // last line without a trailing newline is kept as produced
                mailbox.postOutput(line.toString());
            }
        } catch (IOException e) {
            log.debug("Output of execution {} closed: {}", executionId, e.getMessage());
        } finally {
            mailbox.postEnd();
        }
    }

    /**
     * Forwards input to stdin and output to observers until the output pump reports the end of
     * the stream. Output lines are published live and written to the ledger in batches.
     */
    private void stream(String executionId, Process process, ExecutionMailbox mailbox) throws InterruptedException {
        ScriptOpsProperties.Execution config = properties.getExecution();
        OutputBuffer buffer = new OutputBuffer(config.getFlushThresholdChars(), config.getFlushInterval(), clock);
        Writer stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
        try {
            while (true) {
                ExecutionMailbox.Signal signal = mailbox.poll(buffer.timeUntilDue());
                if (signal == null) {
                    flush(executionId, buffer);
                    continue;
                }
                switch (signal.kind()) {
                    case OUTPUT -> {
                        events.publishOutput(executionId, signal.text());
                        buffer.add(signal.text());
                        if (buffer.isDue()) flush(executionId, buffer);
                    }
                    case INPUT -> {
                        flush(executionId, buffer);
                        appendAndPublish(executionId, ExecutionBanners.inputEcho(signal.text()));
                        writeInput(executionId, stdin, signal.text());
                    }
                    case END -> {
                        flush(executionId, buffer);
                        return;
                    }
                }
            }
        } finally {
            flush(executionId, buffer);
            closeStdin(executionId, stdin);
        }
    }

    private void complete(String executionId, StartExecutionCommand command, int exitCode) {
        ExecutionOutcome outcome = ExecutionOutcome.classify(exitCode);
        if (ledger.finish(executionId, outcome.status(), outcome.banner())) {
            events.publishOutput(executionId, outcome.banner());
            events.publishStatus(executionId, outcome.status());
            log.info("Execution {} finished with exit code {}: {}", executionId, exitCode, outcome.status());
            if (outcome.status() == ExecutionStatus.SUCCESS && command.isScheduled()) {
                applicationEvents.publishEvent(new ScheduledExecutionSucceededEvent(
                        command.scheduleId(), executionId, Instant.now()));
            }
        } else if (ledger.statusOf(executionId) == ExecutionStatus.CANCELLED) {
            appendAndPublish(executionId, ExecutionBanners.TERMINATED_BY_USER);
            log.info("Execution {} was cancelled, process exited with {}", executionId, exitCode);
        } else {
            log.info("Execution {} was already finalized, ignoring exit code {}", executionId, exitCode);
        }
    }

    private void recordFailure(String executionId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String banner = ExecutionBanners.error(message);
        try {
            if (ledger.finish(executionId, ExecutionStatus.FAILED, banner)) {
                events.publishOutput(executionId, banner);
            }
            events.publishStatus(executionId, ledger.statusOf(executionId));
        } catch (Exception e) {
            log.error("Could not record failure of execution {}", executionId, e);
        }
    }

    private void flush(String executionId, OutputBuffer buffer) {
        if (!buffer.isEmpty()) {
            ledger.append(executionId, buffer.drain());
        }
    }

    private void appendAndPublish(String executionId, String text) {
        ledger.append(executionId, text);
        events.publishOutput(executionId, text);
    }

    private void writeInput(String executionId, Writer stdin, String text) {
        try {
            stdin.write(text);
            stdin.flush();
        } catch (IOException e) {
            log.warn("Could not deliver input to execution {}: {}", executionId, e.getMessage());
        }
    }

    private void closeStdin(String executionId, Writer stdin) {
        try {
            stdin.close();
        } catch (IOException e) {
            log.debug("Closing stdin of execution {} failed: {}", executionId, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        Duration grace = properties.getExecution().getKillGrace();
        for (String executionId : processRegistry.activeExecutionIds()) {
            log.info("Terminating process of execution {} on shutdown", executionId);
            processRegistry.terminate(executionId, grace);
        }
        executor.shutdownNow();
    }
}
