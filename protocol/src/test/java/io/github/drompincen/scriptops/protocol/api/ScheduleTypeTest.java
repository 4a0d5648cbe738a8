package io.github.drompincen.scriptops.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleTypeTest {

    @Test
    void parseIsCaseInsensitive() {
        assertThat(ScheduleType.parse("daily")).contains(ScheduleType.DAILY);
        assertThat(ScheduleType.parse(" Interval ")).contains(ScheduleType.INTERVAL);
    }

    @Test
    void parseRejectsUnknownAndBlank() {
        assertThat(ScheduleType.parse("weekly")).isEmpty();
        assertThat(ScheduleType.parse("")).isEmpty();
        assertThat(ScheduleType.parse(null)).isEmpty();
    }
}
