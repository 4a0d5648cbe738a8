package io.github.drompincen.scriptops.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ExecutionDto(
        String executionId,
        String scriptId,
        String scriptName,
        String scriptPath,
        String profileId,
        String profileName,
        String userId,
        String username,
        ExecutionStatus status,
        Instant startTime,
        Instant endTime,
        String output,
        Map<String, Object> parameters,
        boolean scheduled,
        String scheduleId,
        String aiAnalysis,
        String aiSolution
) {}
