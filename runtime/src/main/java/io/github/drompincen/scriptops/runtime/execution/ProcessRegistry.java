package io.github.drompincen.scriptops.runtime.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Live OS processes keyed by execution id.
 */
@Component
public class ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    private final Map<String, Process> processes = new ConcurrentHashMap<>();

    public void register(String executionId, Process process) {
        processes.put(executionId, process);
    }

    public void unregister(String executionId) {
        processes.remove(executionId);
    }

    public Optional<Process> find(String executionId) {
        return Optional.ofNullable(processes.get(executionId));
    }

    public Set<String> activeExecutionIds() {
        return Set.copyOf(processes.keySet());
    }

    /**
     * Terminates the process tree of an execution. Returns false when no process is registered,
     * which is not an error.
     */
    public boolean terminate(String executionId, Duration grace) {
        Process process = processes.get(executionId);
        if (process == null) {
            log.debug("No process registered for execution {}", executionId);
            return false;
        }
        terminateTree(process, grace);
        return true;
    }

    /**
     * Asks the process and all its descendants to stop, waits up to {@code grace}, then
     * force-kills whatever is still alive.
     */
    static void terminateTree(Process process, Duration grace) {
        if (!process.isAlive()) return;

        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();

        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} ignored termination request, killing it", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }
}
