package io.github.drompincen.scriptops.protocol.api;

import java.util.Map;

/**
 * Create or update body for a schedule. On update every field is optional and only the
 * non-null ones are applied.
 */
public record ScheduleRequest(
        String scriptId,
        String profileId,
        String userId,
        String scheduleType,
        String scheduleValue,
        Boolean enabled,
        Map<String, Object> parameters
) {}
