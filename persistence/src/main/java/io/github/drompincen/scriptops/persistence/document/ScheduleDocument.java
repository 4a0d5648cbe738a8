package io.github.drompincen.scriptops.persistence.document;

import io.github.drompincen.scriptops.protocol.api.ScheduleType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "schedules")
public class ScheduleDocument {

    @Id
    private String scheduleId;
    private String scriptId;
    private String profileId;
    private String userId;
    private ScheduleType scheduleType;
    private String scheduleValue;
    @Indexed
    private boolean enabled = true;
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private String jobId;
    private Instant nextRun;
    private Instant lastRun;
    // interval anchor, only reset when type or value changes
    private Instant startTimestamp;
    private Instant createdAt;
    private Instant updatedAt;

    public ScheduleDocument() {}

    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getScriptId() { return scriptId; }
    public void setScriptId(String scriptId) { this.scriptId = scriptId; }
    public String getProfileId() { return profileId; }
    public void setProfileId(String profileId) { this.profileId = profileId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public ScheduleType getScheduleType() { return scheduleType; }
    public void setScheduleType(ScheduleType scheduleType) { this.scheduleType = scheduleType; }
    public String getScheduleValue() { return scheduleValue; }
    public void setScheduleValue(String scheduleValue) { this.scheduleValue = scheduleValue; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public Instant getNextRun() { return nextRun; }
    public void setNextRun(Instant nextRun) { this.nextRun = nextRun; }
    public Instant getLastRun() { return lastRun; }
    public void setLastRun(Instant lastRun) { this.lastRun = lastRun; }
    public Instant getStartTimestamp() { return startTimestamp; }
    public void setStartTimestamp(Instant startTimestamp) { this.startTimestamp = startTimestamp; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
