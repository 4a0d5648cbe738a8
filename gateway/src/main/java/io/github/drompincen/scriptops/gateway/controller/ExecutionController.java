package io.github.drompincen.scriptops.gateway.controller;

import io.github.drompincen.scriptops.protocol.api.AiHelpResponse;
import io.github.drompincen.scriptops.protocol.api.DailyExecutionStats;
import io.github.drompincen.scriptops.protocol.api.ExecutionDto;
import io.github.drompincen.scriptops.protocol.api.ExecutionHistoryPage;
import io.github.drompincen.scriptops.protocol.api.InputRequest;
import io.github.drompincen.scriptops.protocol.api.StartExecutionRequest;
import io.github.drompincen.scriptops.runtime.ai.AiHelpService;
import io.github.drompincen.scriptops.runtime.error.InvalidInputException;
import io.github.drompincen.scriptops.runtime.execution.ExecutionQueryService;
import io.github.drompincen.scriptops.runtime.execution.ScriptRunner;
import io.github.drompincen.scriptops.runtime.execution.StartExecutionCommand;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/executions")
public class ExecutionController {

    private final ScriptRunner scriptRunner;
    private final ExecutionQueryService queryService;
    private final AiHelpService aiHelpService;

    public ExecutionController(ScriptRunner scriptRunner,
                               ExecutionQueryService queryService,
                               AiHelpService aiHelpService) {
        this.scriptRunner = scriptRunner;
        this.queryService = queryService;
        this.aiHelpService = aiHelpService;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> start(@RequestBody StartExecutionRequest req) {
        if (isBlank(req.scriptId()) || isBlank(req.profileId())) {
            throw new InvalidInputException("scriptId and profileId are required");
        }
        String executionId = scriptRunner.start(StartExecutionCommand.manual(
                req.scriptId(), req.profileId(), req.userId(), req.parameters(), req.regionOverride()));
        return ResponseEntity.accepted().body(Map.of("executionId", executionId));
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<ExecutionDto> get(@PathVariable String executionId) {
        return ResponseEntity.ok(queryService.getExecution(executionId));
    }

    @GetMapping("/recent")
    public List<ExecutionDto> recent(@RequestParam(defaultValue = "10") int limit) {
        return queryService.recent(limit);
    }

    @GetMapping("/history")
    public ExecutionHistoryPage history(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer size,
            @RequestParam(required = false) String scriptId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String userId) {
        return queryService.history(page, size, scriptId, status, date, userId);
    }

    @GetMapping("/stats")
    public List<DailyExecutionStats> stats(@RequestParam(defaultValue = "7") int days) {
        return queryService.dailyStats(days);
    }

    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<ExecutionDto> cancel(@PathVariable String executionId) {
        scriptRunner.cancel(executionId);
        return ResponseEntity.ok(queryService.getExecution(executionId));
    }

    @PostMapping("/{executionId}/input")
    public ResponseEntity<Map<String, String>> input(@PathVariable String executionId,
                                                     @RequestBody InputRequest req) {
        if (req == null || req.input() == null) {
            throw new InvalidInputException("input is required");
        }
        scriptRunner.provideInput(executionId, req.input());
        return ResponseEntity.accepted().body(Map.of("executionId", executionId));
    }

    @GetMapping("/{executionId}/ai-help")
    public ResponseEntity<AiHelpResponse> aiHelp(@PathVariable String executionId) {
        return ResponseEntity.ok(aiHelpService.getAiHelp(executionId));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
