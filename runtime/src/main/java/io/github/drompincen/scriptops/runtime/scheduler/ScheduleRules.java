package io.github.drompincen.scriptops.runtime.scheduler;

import io.github.drompincen.scriptops.protocol.api.ScheduleType;
import io.github.drompincen.scriptops.runtime.error.InvalidInputException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Allowed schedule cadences: daily slots every half hour, intervals in whole hours.
 */
public final class ScheduleRules {

    public static final List<String> ALLOWED_TIME_SLOTS = buildTimeSlots();
    public static final Set<String> ALLOWED_INTERVALS = Set.of("1", "2", "3", "4", "6", "8", "12", "24");

    private ScheduleRules() {}

    public static ScheduleType parseType(String value) {
        return ScheduleType.parse(value)
                .orElseThrow(() -> new InvalidInputException("Invalid schedule type"));
    }

    public static void validateValue(ScheduleType type, String value) {
        if (type == ScheduleType.DAILY && (value == null || !ALLOWED_TIME_SLOTS.contains(value))) {
            throw new InvalidInputException("Invalid schedule time. Please select from available options.");
        }
        if (type == ScheduleType.INTERVAL && (value == null || !ALLOWED_INTERVALS.contains(value))) {
            throw new InvalidInputException("Invalid interval. Please select from available options.");
        }
    }

    private static List<String> buildTimeSlots() {
        DateTimeFormatter format = DateTimeFormatter.ofPattern("HH:mm");
        List<String> slots = new ArrayList<>();
        LocalTime slot = LocalTime.MIDNIGHT;
        for (int i = 0; i < 48; i++) {
            slots.add(slot.format(format));
            slot = slot.plusMinutes(30);
        }
        return Collections.unmodifiableList(slots);
    }
}
