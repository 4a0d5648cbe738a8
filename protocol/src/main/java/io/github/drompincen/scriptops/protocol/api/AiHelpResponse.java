package io.github.drompincen.scriptops.protocol.api;

public record AiHelpResponse(
        String executionId,
        String analysis,
        String solution,
        boolean cached
) {}
