package io.github.drompincen.scriptops.protocol.event;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;

import java.time.Instant;

/**
 * Live notification about one execution. Status events carry {@code status}, output events
 * carry {@code chunk}; the other field is null.
 */
public record ExecutionEvent(
        ExecutionEventType type,
        String executionId,
        ExecutionStatus status,
        String chunk,
        Instant timestamp
) {
    public static ExecutionEvent statusChanged(String executionId, ExecutionStatus status) {
        return new ExecutionEvent(ExecutionEventType.STATUS_CHANGED, executionId, status, null, Instant.now());
    }

    public static ExecutionEvent outputAppended(String executionId, String chunk) {
        return new ExecutionEvent(ExecutionEventType.OUTPUT_APPENDED, executionId, null, chunk, Instant.now());
    }
}
