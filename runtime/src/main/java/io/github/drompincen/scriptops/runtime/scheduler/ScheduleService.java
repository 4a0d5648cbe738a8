package io.github.drompincen.scriptops.runtime.scheduler;

import io.github.drompincen.scriptops.persistence.document.ScheduleDocument;
import io.github.drompincen.scriptops.persistence.repository.ScheduleRepository;
import io.github.drompincen.scriptops.protocol.api.ScheduleDto;
import io.github.drompincen.scriptops.protocol.api.ScheduleRequest;
import io.github.drompincen.scriptops.protocol.api.ScheduleType;
import io.github.drompincen.scriptops.runtime.error.InvalidInputException;
import io.github.drompincen.scriptops.runtime.error.ProfileNotFoundException;
import io.github.drompincen.scriptops.runtime.error.ScheduleNotFoundException;
import io.github.drompincen.scriptops.runtime.error.ScriptNotFoundException;
import io.github.drompincen.scriptops.runtime.execution.ScheduledExecutionSucceededEvent;
import io.github.drompincen.scriptops.runtime.execution.ScriptRunner;
import io.github.drompincen.scriptops.runtime.execution.StartExecutionCommand;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfile;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfileLookup;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import io.github.drompincen.scriptops.runtime.lookup.ScriptLookup;
import io.github.drompincen.scriptops.runtime.lookup.UserLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.Trigger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Lifecycle of recurring schedules: validation, persistence and keeping exactly one armed
 * trigger per enabled schedule, including re-arming everything at startup.
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository scheduleRepository;
    private final ScheduleTriggerRegistry triggerRegistry;
    private final NextRunCalculator calculator;
    private final ScriptRunner scriptRunner;
    private final ScriptLookup scriptLookup;
    private final CredentialProfileLookup profileLookup;
    private final UserLookup userLookup;

    public ScheduleService(ScheduleRepository scheduleRepository,
                           ScheduleTriggerRegistry triggerRegistry,
                           NextRunCalculator calculator,
                           ScriptRunner scriptRunner,
                           ScriptLookup scriptLookup,
                           CredentialProfileLookup profileLookup,
                           UserLookup userLookup) {
        this.scheduleRepository = scheduleRepository;
        this.triggerRegistry = triggerRegistry;
        this.calculator = calculator;
        this.scriptRunner = scriptRunner;
        this.scriptLookup = scriptLookup;
        this.profileLookup = profileLookup;
        this.userLookup = userLookup;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public List<ScheduleDto> list(boolean includeDisabled) {
        List<ScheduleDocument> schedules = includeDisabled
                ? scheduleRepository.findAllByOrderByCreatedAtDesc()
                : scheduleRepository.findByEnabledOrderByCreatedAtDesc(true);
        return schedules.stream().map(this::toDto).collect(Collectors.toList());
    }

    public ScheduleDto get(String scheduleId) {
        return toDto(load(scheduleId));
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    public ScheduleDto create(ScheduleRequest request) {
        ScheduleType type = ScheduleRules.parseType(request.scheduleType());
        ScheduleRules.validateValue(type, request.scheduleValue());
        requireScript(request.scriptId());
        requireProfile(request.profileId());

        Instant now = calculator.now();
        ScheduleDocument doc = new ScheduleDocument();
        doc.setScheduleId(UUID.randomUUID().toString());
        doc.setScriptId(request.scriptId());
        doc.setProfileId(request.profileId());
        doc.setUserId(request.userId());
        doc.setScheduleType(type);
        doc.setScheduleValue(request.scheduleValue());
        doc.setEnabled(request.enabled() == null || request.enabled());
        doc.setParameters(copy(request.parameters()));
        doc.setStartTimestamp(now);
        doc.setJobId(newJobId());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        if (doc.isEnabled()) {
            arm(doc);
        }
        scheduleRepository.save(doc);
        log.info("Created {} schedule {} ({}) for script {}, next run {}",
                type, doc.getScheduleId(), doc.getScheduleValue(), doc.getScriptId(), doc.getNextRun());
        return toDto(doc);
    }

    /**
     * Applies the non-null fields of {@code request}. Changing type or value restarts the
     * interval phase and issues a new job id; other changes keep the anchor.
     */
    public ScheduleDto update(String scheduleId, ScheduleRequest request) {
        ScheduleDocument doc = load(scheduleId);
        if (isEmpty(request)) {
            throw new InvalidInputException("No fields to update");
        }

        ScheduleType type = request.scheduleType() != null
                ? ScheduleRules.parseType(request.scheduleType())
                : doc.getScheduleType();
        String value = request.scheduleValue() != null ? request.scheduleValue() : doc.getScheduleValue();
        boolean cadenceChanged = type != doc.getScheduleType() || !Objects.equals(value, doc.getScheduleValue());
        if (cadenceChanged) {
            ScheduleRules.validateValue(type, value);
        }
        if (request.scriptId() != null) requireScript(request.scriptId());
        if (request.profileId() != null) requireProfile(request.profileId());

        if (request.scriptId() != null) doc.setScriptId(request.scriptId());
        if (request.profileId() != null) doc.setProfileId(request.profileId());
        if (request.userId() != null) doc.setUserId(request.userId());
        if (request.parameters() != null) doc.setParameters(copy(request.parameters()));
        if (request.enabled() != null) doc.setEnabled(request.enabled());
        if (cadenceChanged) {
            doc.setScheduleType(type);
            doc.setScheduleValue(value);
            doc.setStartTimestamp(calculator.now());
            doc.setNextRun(null);
            doc.setJobId(newJobId());
        }

        if (doc.isEnabled()) {
            arm(doc);
        } else {
            triggerRegistry.unregister(scheduleId);
        }
        doc.setUpdatedAt(calculator.now());
        scheduleRepository.save(doc);
        log.info("Updated schedule {} (enabled={}, cadenceChanged={}), next run {}",
                scheduleId, doc.isEnabled(), cadenceChanged, doc.getNextRun());
        return toDto(doc);
    }

    public void delete(String scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }
        triggerRegistry.unregister(scheduleId);
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }

    /** Starts the schedule's script right away as a manual run; the trigger is untouched. */
    public String runNow(String scheduleId) {
        ScheduleDocument doc = load(scheduleId);
        String executionId = scriptRunner.start(StartExecutionCommand.manual(
                doc.getScriptId(), doc.getProfileId(), doc.getUserId(), doc.getParameters(), null));
        log.info("Schedule {} run manually as execution {}", scheduleId, executionId);
        return executionId;
    }

    // ------------------------------------------------------------------
    // Trigger callbacks
    // ------------------------------------------------------------------

    void fire(String scheduleId) {
        Optional<ScheduleDocument> found = scheduleRepository.findById(scheduleId);
        if (found.isEmpty() || !found.get().isEnabled()) {
            log.warn("Schedule {} fired but is missing or disabled, skipping", scheduleId);
            return;
        }
        ScheduleDocument doc = found.get();
        String executionId = scriptRunner.start(StartExecutionCommand.scheduled(
                doc.getScriptId(), doc.getProfileId(), doc.getUserId(), doc.getParameters(), scheduleId));
        log.info("Schedule {} fired execution {}", scheduleId, executionId);
    }

    @EventListener
    public void onScheduledRunSucceeded(ScheduledExecutionSucceededEvent event) {
        try {
            String scheduleId = event.scheduleId();
            // a trigger removed meanwhile (disable, delete) leaves nextRun as the edit wrote it
            Optional<Instant> nextRun = triggerRegistry.nextFireTime(scheduleId);
            long matched = nextRun.isPresent()
                    ? scheduleRepository.updateRunTimes(scheduleId, event.completedAt(), nextRun.get())
                    : scheduleRepository.updateLastRun(scheduleId, event.completedAt());
            if (matched == 0) {
                log.debug("Schedule {} no longer exists, completion of {} not recorded", scheduleId, event.executionId());
            } else {
                log.debug("Schedule {} last run {}, next run {}", scheduleId, event.completedAt(), nextRun.orElse(null));
            }
        } catch (Exception e) {
            log.error("Failed to record completion of execution {} for schedule {}",
                    event.executionId(), event.scheduleId(), e);
        }
    }

    /** Re-arms every enabled schedule. A schedule that cannot be restored is logged and skipped. */
    @EventListener(ApplicationReadyEvent.class)
    public void loadSchedules() {
        int loaded = 0;
        for (ScheduleDocument doc : scheduleRepository.findByEnabled(true)) {
            try {
                arm(doc);
                scheduleRepository.save(doc);
                loaded++;
            } catch (Exception e) {
                log.error("Failed to restore schedule {}", doc.getScheduleId(), e);
            }
        }
        log.info("Restored {} schedule(s)", loaded);
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void arm(ScheduleDocument doc) {
        if (doc.getScheduleType() == null) {
            throw new InvalidInputException("Invalid schedule type");
        }
        ScheduleRules.validateValue(doc.getScheduleType(), doc.getScheduleValue());

        Trigger trigger;
        Instant nextRun;
        if (doc.getScheduleType() == ScheduleType.DAILY) {
            trigger = calculator.dailyTrigger(doc.getScheduleValue());
            nextRun = calculator.nextDaily(doc.getScheduleValue());
        } else {
            Duration interval = Duration.ofHours(Integer.parseInt(doc.getScheduleValue()));
            IntervalPlan plan = calculator.planInterval(interval, doc.getStartTimestamp(), doc.getNextRun());
            doc.setStartTimestamp(plan.anchor());
            trigger = new AnchoredIntervalTrigger(plan.anchor(), interval, plan.firstFire());
            nextRun = plan.firstFire();
        }
        if (doc.getJobId() == null) {
            doc.setJobId(newJobId());
        }

        String scheduleId = doc.getScheduleId();
        triggerRegistry.register(scheduleId, doc.getJobId(), trigger, () -> fire(scheduleId));
        doc.setNextRun(nextRun);
    }

    private ScheduleDocument load(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    private void requireScript(String scriptId) {
        if (scriptLookup.findScript(scriptId).isEmpty()) {
            throw new ScriptNotFoundException(scriptId);
        }
    }

    private void requireProfile(String profileId) {
        if (profileLookup.findProfile(profileId).isEmpty()) {
            throw new ProfileNotFoundException(profileId);
        }
    }

    private static boolean isEmpty(ScheduleRequest request) {
        return request.scriptId() == null && request.profileId() == null && request.userId() == null
                && request.scheduleType() == null && request.scheduleValue() == null
                && request.enabled() == null && request.parameters() == null;
    }

    private static Map<String, Object> copy(Map<String, Object> parameters) {
        return parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    private static String newJobId() {
        return "job-" + UUID.randomUUID();
    }

    private ScheduleDto toDto(ScheduleDocument doc) {
        return new ScheduleDto(
                doc.getScheduleId(),
                doc.getScriptId(),
                scriptLookup.findScript(doc.getScriptId()).map(ScriptInfo::name).orElse(null),
                doc.getProfileId(),
                profileLookup.findProfile(doc.getProfileId()).map(CredentialProfile::name).orElse(null),
                doc.getUserId(),
                userLookup.findUsername(doc.getUserId()).orElse(null),
                doc.getScheduleType(),
                doc.getScheduleValue(),
                doc.isEnabled(),
                doc.getParameters(),
                doc.getJobId(),
                doc.getNextRun(),
                doc.getLastRun(),
                doc.getStartTimestamp(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
