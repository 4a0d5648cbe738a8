package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.runtime.error.NoActiveExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-execution stdin mailboxes. A mailbox exists only while the execution's process is alive;
 * the runner opens it before spawning and closes it when the worker ends.
 */
@Component
public class InteractiveInputChannel {

    private static final Logger log = LoggerFactory.getLogger(InteractiveInputChannel.class);

    private final Map<String, ExecutionMailbox> mailboxes = new ConcurrentHashMap<>();

    ExecutionMailbox open(String executionId) {
        ExecutionMailbox mailbox = new ExecutionMailbox();
        mailboxes.put(executionId, mailbox);
        return mailbox;
    }

    void close(String executionId) {
        mailboxes.remove(executionId);
    }

    public boolean isOpen(String executionId) {
        return mailboxes.containsKey(executionId);
    }

    /**
     * Queues {@code text} plus a newline for the process's stdin.
     *
     * @throws NoActiveExecutionException when the execution has no live process
     */
    public void provideInput(String executionId, String text) {
        ExecutionMailbox mailbox = mailboxes.get(executionId);
        if (mailbox == null) {
            throw new NoActiveExecutionException(executionId);
        }
        mailbox.postInput((text != null ? text : "") + "\n");
        log.debug("Queued input for execution {}", executionId);
    }
}
