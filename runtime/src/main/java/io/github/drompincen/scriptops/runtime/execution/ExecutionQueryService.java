package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.persistence.repository.ExecutionRepository;
import io.github.drompincen.scriptops.protocol.api.DailyExecutionStats;
import io.github.drompincen.scriptops.protocol.api.ExecutionDto;
import io.github.drompincen.scriptops.protocol.api.ExecutionHistoryPage;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.InvalidInputException;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfile;
import io.github.drompincen.scriptops.runtime.lookup.CredentialProfileLookup;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import io.github.drompincen.scriptops.runtime.lookup.ScriptLookup;
import io.github.drompincen.scriptops.runtime.lookup.SettingsLookup;
import io.github.drompincen.scriptops.runtime.lookup.UserLookup;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read side of the execution ledger: single lookups, recent runs, filtered history and
 * per-day counts, joined with script, profile and user display names.
 */
@Service
public class ExecutionQueryService {

    static final int DEFAULT_PAGE_SIZE = 10;

    private final ExecutionLedger ledger;
    private final ExecutionRepository executionRepository;
    private final MongoTemplate mongoTemplate;
    private final ScriptLookup scriptLookup;
    private final CredentialProfileLookup profileLookup;
    private final UserLookup userLookup;
    private final SettingsLookup settings;
    private final ScriptOpsProperties properties;

    public ExecutionQueryService(ExecutionLedger ledger,
                                 ExecutionRepository executionRepository,
                                 MongoTemplate mongoTemplate,
                                 ScriptLookup scriptLookup,
                                 CredentialProfileLookup profileLookup,
                                 UserLookup userLookup,
                                 SettingsLookup settings,
                                 ScriptOpsProperties properties) {
        this.ledger = ledger;
        this.executionRepository = executionRepository;
        this.mongoTemplate = mongoTemplate;
        this.scriptLookup = scriptLookup;
        this.profileLookup = profileLookup;
        this.userLookup = userLookup;
        this.settings = settings;
        this.properties = properties;
    }

    public ExecutionDto getExecution(String executionId) {
        return toDto(ledger.get(executionId));
    }

    public List<ExecutionDto> recent(int limit) {
        if (limit <= 0) {
            throw new InvalidInputException("limit must be positive");
        }
        return executionRepository.findAllByOrderByStartTimeDesc(PageRequest.of(0, limit)).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    /**
     * One page of history, newest first. {@code page} is 1-based; a null {@code pageSize}
     * falls back to the {@code history_limit} setting.
     */
    public ExecutionHistoryPage history(int page, Integer pageSize, String scriptId, String status,
                                        LocalDate date, String userId) {
        if (page < 1) {
            throw new InvalidInputException("page must be 1 or greater");
        }
        int size = pageSize != null ? pageSize : configuredPageSize();
        if (size < 1) {
            throw new InvalidInputException("page size must be positive");
        }

        Query query = new Query();
        if (scriptId != null && !scriptId.isBlank()) {
            query.addCriteria(Criteria.where("scriptId").is(scriptId));
        }
        if (status != null && !status.isBlank()) {
            query.addCriteria(Criteria.where("status").is(parseStatus(status)));
        }
        if (userId != null && !userId.isBlank()) {
            query.addCriteria(Criteria.where("userId").is(userId));
        }
        if (date != null) {
            ZoneId zone = properties.zoneId();
            Instant from = date.atStartOfDay(zone).toInstant();
            Instant to = date.plusDays(1).atStartOfDay(zone).toInstant();
            query.addCriteria(Criteria.where("startTime").gte(from).lt(to));
        }

        long total = mongoTemplate.count(query, ExecutionDocument.class);
        query.with(PageRequest.of(page - 1, size, Sort.by(Sort.Direction.DESC, "startTime")));
        List<ExecutionDto> executions = mongoTemplate.find(query, ExecutionDocument.class).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
        int totalPages = (int) ((total + size - 1) / size);
        return new ExecutionHistoryPage(executions, page, totalPages, total);
    }

    /** Status counts for each of the last {@code days} days, oldest first, today included. */
    public List<DailyExecutionStats> dailyStats(int days) {
        if (days < 1) {
            throw new InvalidInputException("days must be positive");
        }
        ZoneId zone = properties.zoneId();
        LocalDate today = LocalDate.now(zone);
        LocalDate first = today.minusDays(days - 1L);

        Map<LocalDate, Map<ExecutionStatus, Long>> counts = new TreeMap<>();
        for (LocalDate d = first; !d.isAfter(today); d = d.plusDays(1)) {
            counts.put(d, new EnumMap<>(ExecutionStatus.class));
        }
        for (ExecutionDocument doc : executionRepository.findByStartTimeGreaterThanEqual(first.atStartOfDay(zone).toInstant())) {
            if (doc.getStartTime() == null || doc.getStatus() == null) continue;
            Map<ExecutionStatus, Long> day = counts.get(LocalDate.ofInstant(doc.getStartTime(), zone));
            if (day != null) {
                day.merge(doc.getStatus(), 1L, Long::sum);
            }
        }

        List<DailyExecutionStats> stats = new ArrayList<>();
        counts.forEach((date, byStatus) -> stats.add(new DailyExecutionStats(
                date,
                byStatus.getOrDefault(ExecutionStatus.SUCCESS, 0L),
                byStatus.getOrDefault(ExecutionStatus.FAILED, 0L),
                byStatus.getOrDefault(ExecutionStatus.RUNNING, 0L),
                byStatus.getOrDefault(ExecutionStatus.CANCELLED, 0L))));
        return stats;
    }

    ExecutionDto toDto(ExecutionDocument doc) {
        ScriptInfo script = scriptLookup.findScript(doc.getScriptId()).orElse(null);
        String profileName = profileLookup.findProfile(doc.getProfileId()).map(CredentialProfile::name).orElse(null);
        String username = userLookup.findUsername(doc.getUserId()).orElse(null);
        return new ExecutionDto(
                doc.getExecutionId(),
                doc.getScriptId(),
                script != null ? script.name() : null,
                script != null ? script.path() : null,
                doc.getProfileId(),
                profileName,
                doc.getUserId(),
                username,
                doc.getStatus(),
                doc.getStartTime(),
                doc.getEndTime(),
                doc.getOutput(),
                doc.getParameters(),
                doc.isScheduled(),
                doc.getScheduleId(),
                doc.getAiAnalysis(),
                doc.getAiSolution()
        );
    }

    private int configuredPageSize() {
        String raw = settings.get(SettingsLookup.HISTORY_LIMIT, String.valueOf(DEFAULT_PAGE_SIZE));
        try {
            int size = Integer.parseInt(raw.trim());
            return size > 0 ? size : DEFAULT_PAGE_SIZE;
        } catch (NumberFormatException e) {
            return DEFAULT_PAGE_SIZE;
        }
    }

    private static ExecutionStatus parseStatus(String status) {
        try {
            return ExecutionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown execution status: " + status);
        }
    }
}
