package io.github.drompincen.scriptops.gateway.controller;

import io.github.drompincen.scriptops.protocol.api.ScheduleDto;
import io.github.drompincen.scriptops.protocol.api.ScheduleRequest;
import io.github.drompincen.scriptops.runtime.scheduler.ScheduleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class ScheduleController {

    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping("/api/schedules")
    public List<ScheduleDto> listSchedules(@RequestParam(defaultValue = "false") boolean includeDisabled) {
        return scheduleService.list(includeDisabled);
    }

    @GetMapping("/api/schedules/{scheduleId}")
    public ResponseEntity<ScheduleDto> getSchedule(@PathVariable String scheduleId) {
        return ResponseEntity.ok(scheduleService.get(scheduleId));
    }

    @PostMapping("/api/schedules")
    public ResponseEntity<ScheduleDto> createSchedule(@RequestBody ScheduleRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scheduleService.create(req));
    }

    @PutMapping("/api/schedules/{scheduleId}")
    public ResponseEntity<ScheduleDto> updateSchedule(@PathVariable String scheduleId,
                                                      @RequestBody ScheduleRequest req) {
        return ResponseEntity.ok(scheduleService.update(scheduleId, req));
    }

    @DeleteMapping("/api/schedules/{scheduleId}")
    public ResponseEntity<Void> deleteSchedule(@PathVariable String scheduleId) {
        scheduleService.delete(scheduleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/api/schedules/{scheduleId}/run")
    public ResponseEntity<Map<String, String>> runNow(@PathVariable String scheduleId) {
        String executionId = scheduleService.runNow(scheduleId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("executionId", executionId));
    }
}
