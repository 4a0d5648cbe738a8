package io.github.drompincen.scriptops.runtime.execution;

import java.time.Instant;

/** Published when a schedule-fired execution exits successfully. */
public record ScheduledExecutionSucceededEvent(String scheduleId, String executionId, Instant completedAt) {}
