package io.github.drompincen.scriptops.protocol.event;

public enum ExecutionEventType {
    STATUS_CHANGED,
    OUTPUT_APPENDED
}
