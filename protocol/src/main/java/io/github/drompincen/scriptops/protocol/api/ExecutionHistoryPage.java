package io.github.drompincen.scriptops.protocol.api;

import java.util.List;

public record ExecutionHistoryPage(
        List<ExecutionDto> executions,
        int currentPage,
        int totalPages,
        long totalCount
) {}
