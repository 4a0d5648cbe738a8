package io.github.drompincen.scriptops.protocol.api;

import java.util.Map;

public record StartExecutionRequest(
        String scriptId,
        String profileId,
        String userId,
        Map<String, Object> parameters,
        String regionOverride
) {}
