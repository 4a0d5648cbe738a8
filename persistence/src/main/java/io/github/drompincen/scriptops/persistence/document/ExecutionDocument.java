package io.github.drompincen.scriptops.persistence.document;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Document(collection = "executions")
@CompoundIndex(name = "status_start_idx", def = "{'status': 1, 'startTime': -1}")
@CompoundIndex(name = "script_start_idx", def = "{'scriptId': 1, 'startTime': -1}")
public class ExecutionDocument {

    @Id
    private String executionId;
    private String scriptId;
    private String profileId;
    @Indexed
    private String userId;
    private ExecutionStatus status;
    private Instant startTime;
    private Instant endTime;
    private String output = "";
    private Map<String, Object> parameters = new LinkedHashMap<>();
    private String regionOverride;
    private boolean scheduled;
    @Indexed
    private String scheduleId;
    private String aiAnalysis;
    private String aiSolution;
    private Instant createdAt;

    public ExecutionDocument() {}

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public String getScriptId() { return scriptId; }
    public void setScriptId(String scriptId) { this.scriptId = scriptId; }
    public String getProfileId() { return profileId; }
    public void setProfileId(String profileId) { this.profileId = profileId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public ExecutionStatus getStatus() { return status; }
    public void setStatus(ExecutionStatus status) { this.status = status; }
    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }
    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }
    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }
    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }
    public String getRegionOverride() { return regionOverride; }
    public void setRegionOverride(String regionOverride) { this.regionOverride = regionOverride; }
    public boolean isScheduled() { return scheduled; }
    public void setScheduled(boolean scheduled) { this.scheduled = scheduled; }
    public String getScheduleId() { return scheduleId; }
    public void setScheduleId(String scheduleId) { this.scheduleId = scheduleId; }
    public String getAiAnalysis() { return aiAnalysis; }
    public void setAiAnalysis(String aiAnalysis) { this.aiAnalysis = aiAnalysis; }
    public String getAiSolution() { return aiSolution; }
    public void setAiSolution(String aiSolution) { this.aiSolution = aiSolution; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
