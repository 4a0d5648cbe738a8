package io.github.drompincen.scriptops.protocol.api;

import java.time.LocalDate;

public record DailyExecutionStats(
        LocalDate date,
        long success,
        long failed,
        long running,
        long cancelled
) {}
