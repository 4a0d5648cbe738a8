package io.github.drompincen.scriptops.runtime.error;

public class ScheduleNotFoundException extends NotFoundException {

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
    }
}
