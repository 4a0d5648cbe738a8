package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.protocol.event.ExecutionEvent;

public interface ExecutionEventListener {
    void onEvent(ExecutionEvent event);
    default void onError(Throwable t) {}
}
