package io.github.drompincen.scriptops.protocol.api;

import java.util.Locale;
import java.util.Optional;

public enum ScheduleType {
    DAILY,
    INTERVAL;

    /** Case-insensitive lookup; empty for unknown or blank values. */
    public static Optional<ScheduleType> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
