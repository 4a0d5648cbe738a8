package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.protocol.event.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans live execution events out to in-process listeners. Listeners are called on the
 * publishing thread, so events of one execution reach them in the order they were produced.
 */
@Component
public class ExecutionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventPublisher.class);

    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ExecutionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ExecutionEventListener listener) {
        listeners.remove(listener);
    }

    public void publishStatus(String executionId, ExecutionStatus status) {
        notifyListeners(ExecutionEvent.statusChanged(executionId, status));
    }

    public void publishOutput(String executionId, String chunk) {
        if (chunk == null || chunk.isEmpty()) return;
        notifyListeners(ExecutionEvent.outputAppended(executionId, chunk));
    }

    private void notifyListeners(ExecutionEvent event) {
        for (ExecutionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Listener error for {} event of execution {}", event.type(), event.executionId(), e);
                listener.onError(e);
            }
        }
    }
}
