package io.github.drompincen.scriptops.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings bound from the {@code scriptops.*} keys of the application configuration.
 * Values that operators change at runtime (timeouts, AI keys) live in the settings
 * collection instead.
 */
@Component
@ConfigurationProperties(prefix = "scriptops")
public class ScriptOpsProperties {

    /** Zone used for daily slots, history date filters and per-day statistics. */
    private String zone = ZoneId.systemDefault().getId();
    private final Execution execution = new Execution();
    private final Ai ai = new Ai();

    public String getZone() { return zone; }
    public void setZone(String zone) { this.zone = zone; }
    public Execution getExecution() { return execution; }
    public Ai getAi() { return ai; }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public static class Execution {
        private Duration killGrace = Duration.ofSeconds(5);
        private int flushThresholdChars = 1000;
        private Duration flushInterval = Duration.ofSeconds(1);
        // file extension -> interpreter; other extensions are executed directly
        private Map<String, String> interpreters = new LinkedHashMap<>(Map.of(
                "py", "python3",
                "sh", "sh"));

        public Duration getKillGrace() { return killGrace; }
        public void setKillGrace(Duration killGrace) { this.killGrace = killGrace; }
        public int getFlushThresholdChars() { return flushThresholdChars; }
        public void setFlushThresholdChars(int flushThresholdChars) { this.flushThresholdChars = flushThresholdChars; }
        public Duration getFlushInterval() { return flushInterval; }
        public void setFlushInterval(Duration flushInterval) { this.flushInterval = flushInterval; }
        public Map<String, String> getInterpreters() { return interpreters; }
        public void setInterpreters(Map<String, String> interpreters) { this.interpreters = interpreters; }
    }

    public static class Ai {
        private String model = "gpt-4";
        private double temperature = 0.3;
        private int maxSourceChars = 2000;
        private int maxErrorChars = 2000;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public int getMaxSourceChars() { return maxSourceChars; }
        public void setMaxSourceChars(int maxSourceChars) { this.maxSourceChars = maxSourceChars; }
        public int getMaxErrorChars() { return maxErrorChars; }
        public void setMaxErrorChars(int maxErrorChars) { this.maxErrorChars = maxErrorChars; }
    }
}
