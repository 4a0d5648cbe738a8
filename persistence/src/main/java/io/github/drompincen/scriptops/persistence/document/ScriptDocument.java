package io.github.drompincen.scriptops.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "scripts")
public class ScriptDocument {

    @Id
    private String scriptId;
    private String name;
    private String path;
    private String description;
    private List<ParameterDefinition> parameters = new ArrayList<>();
    private Instant createdAt;

    public ScriptDocument() {}

    // Embedded: ParameterDefinition
    public static class ParameterDefinition {
        private String name;
        private String type;
        private boolean required;
        private String defaultValue;

        public ParameterDefinition() {}

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }
        public String getDefaultValue() { return defaultValue; }
        public void setDefaultValue(String defaultValue) { this.defaultValue = defaultValue; }
    }

    public String getScriptId() { return scriptId; }
    public void setScriptId(String scriptId) { this.scriptId = scriptId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public List<ParameterDefinition> getParameters() { return parameters; }
    public void setParameters(List<ParameterDefinition> parameters) { this.parameters = parameters; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
