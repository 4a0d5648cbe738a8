package io.github.drompincen.scriptops.protocol.api;

import java.time.Instant;
import java.util.Map;

public record ScheduleDto(
        String scheduleId,
        String scriptId,
        String scriptName,
        String profileId,
        String profileName,
        String userId,
        String username,
        ScheduleType scheduleType,
        String scheduleValue,
        boolean enabled,
        Map<String, Object> parameters,
        String jobId,
        Instant nextRun,
        Instant lastRun,
        Instant startTimestamp,
        Instant createdAt,
        Instant updatedAt
) {}
