package io.github.drompincen.scriptops.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String executionId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String executionId, JsonNode payload) {
        return new WsMessage(type, executionId, payload, Instant.now());
    }

    public static WsMessage error(String executionId, JsonNode payload) {
        return of(WsMessageType.ERROR, executionId, payload);
    }
}
