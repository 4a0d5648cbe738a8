package io.github.drompincen.scriptops.persistence.repository;

import io.github.drompincen.scriptops.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.scriptops.persistence.document.ScheduleDocument;
import io.github.drompincen.scriptops.protocol.api.ScheduleType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleRepositoryTest extends AbstractMongoIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-05-01T08:00:00Z");

    @Autowired
    private ScheduleRepository scheduleRepository;

    @Test
    void findByEnabled() {
        scheduleRepository.save(createSchedule("sc1", true, T0));
        scheduleRepository.save(createSchedule("sc2", false, T0.plusSeconds(10)));
        scheduleRepository.save(createSchedule("sc3", true, T0.plusSeconds(20)));

        assertThat(scheduleRepository.findByEnabled(true))
                .extracting(ScheduleDocument::getScheduleId).containsExactlyInAnyOrder("sc1", "sc3");
        assertThat(scheduleRepository.findByEnabled(false))
                .extracting(ScheduleDocument::getScheduleId).containsExactly("sc2");
    }

    @Test
    void findAllByOrderByCreatedAtDesc() {
        scheduleRepository.save(createSchedule("sc1", true, T0));
        scheduleRepository.save(createSchedule("sc2", false, T0.plusSeconds(20)));
        scheduleRepository.save(createSchedule("sc3", true, T0.plusSeconds(10)));

        List<ScheduleDocument> result = scheduleRepository.findAllByOrderByCreatedAtDesc();
        assertThat(result).extracting(ScheduleDocument::getScheduleId).containsExactly("sc2", "sc3", "sc1");
    }

    @Test
    void findByEnabledOrderByCreatedAtDesc() {
        scheduleRepository.save(createSchedule("sc1", true, T0));
        scheduleRepository.save(createSchedule("sc2", false, T0.plusSeconds(30)));
        scheduleRepository.save(createSchedule("sc3", true, T0.plusSeconds(10)));

        List<ScheduleDocument> result = scheduleRepository.findByEnabledOrderByCreatedAtDesc(true);
        assertThat(result).extracting(ScheduleDocument::getScheduleId).containsExactly("sc3", "sc1");
    }

    @Test
    void updateRunTimes_setsTimestampsWithoutTouchingOtherFields() {
        ScheduleDocument disabled = createSchedule("sc1", false, T0);
        disabled.setScheduleValue("15");
        scheduleRepository.save(disabled);

        Instant lastRun = T0.plusSeconds(900);
        Instant nextRun = T0.plusSeconds(1800);
        long matched = scheduleRepository.updateRunTimes("sc1", lastRun, nextRun);

        assertThat(matched).isEqualTo(1);
        ScheduleDocument stored = scheduleRepository.findById("sc1").orElseThrow();
        assertThat(stored.getLastRun()).isEqualTo(lastRun);
        assertThat(stored.getNextRun()).isEqualTo(nextRun);
        assertThat(stored.isEnabled()).isFalse();
        assertThat(stored.getScheduleValue()).isEqualTo("15");
    }

    @Test
    void updateLastRun_keepsNextRun() {
        ScheduleDocument doc = createSchedule("sc1", false, T0);
        doc.setNextRun(T0.plusSeconds(600));
        scheduleRepository.save(doc);

        scheduleRepository.updateLastRun("sc1", T0.plusSeconds(300));

        ScheduleDocument stored = scheduleRepository.findById("sc1").orElseThrow();
        assertThat(stored.getLastRun()).isEqualTo(T0.plusSeconds(300));
        assertThat(stored.getNextRun()).isEqualTo(T0.plusSeconds(600));
        assertThat(stored.isEnabled()).isFalse();
    }

    @Test
    void updateRunTimes_unknownId_matchesNothing() {
        assertThat(scheduleRepository.updateRunTimes("missing", T0, T0.plusSeconds(60))).isZero();
        assertThat(scheduleRepository.updateLastRun("missing", T0)).isZero();
        assertThat(scheduleRepository.count()).isZero();
    }

    private ScheduleDocument createSchedule(String id, boolean enabled, Instant createdAt) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setScheduleId(id);
        doc.setScriptId("s1");
        doc.setProfileId("p1");
        doc.setUserId("u1");
        doc.setScheduleType(ScheduleType.INTERVAL);
        doc.setScheduleValue("5");
        doc.setEnabled(enabled);
        doc.setStartTimestamp(createdAt);
        doc.setCreatedAt(createdAt);
        doc.setUpdatedAt(createdAt);
        return doc;
    }
}
