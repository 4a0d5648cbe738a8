package io.github.drompincen.scriptops.runtime.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the runner needs to launch one execution. {@code scheduleId} is set only for runs
 * fired by a schedule trigger.
 */
public record StartExecutionCommand(
        String scriptId,
        String profileId,
        String userId,
        Map<String, Object> parameters,
        String regionOverride,
        String scheduleId
) {
    public StartExecutionCommand {
        parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    public static StartExecutionCommand manual(String scriptId, String profileId, String userId,
                                               Map<String, Object> parameters, String regionOverride) {
        return new StartExecutionCommand(scriptId, profileId, userId, parameters, regionOverride, null);
    }

    public static StartExecutionCommand scheduled(String scriptId, String profileId, String userId,
                                                  Map<String, Object> parameters, String scheduleId) {
        return new StartExecutionCommand(scriptId, profileId, userId, parameters, null, scheduleId);
    }

    public boolean isScheduled() {
        return scheduleId != null;
    }
}
