package io.github.drompincen.scriptops.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE_EXECUTION,
    SUBSCRIBE_ALL,
    UNSUBSCRIBE,

    // Server -> Client
    STATUS_CHANGED,
    OUTPUT_APPENDED,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
