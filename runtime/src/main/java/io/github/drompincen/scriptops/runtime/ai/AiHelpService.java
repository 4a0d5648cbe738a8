package io.github.drompincen.scriptops.runtime.ai;

import io.github.drompincen.scriptops.persistence.document.ExecutionDocument;
import io.github.drompincen.scriptops.protocol.api.AiHelpResponse;
import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;
import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.NotFoundException;
import io.github.drompincen.scriptops.runtime.error.PreconditionFailedException;
import io.github.drompincen.scriptops.runtime.execution.ExecutionLedger;
import io.github.drompincen.scriptops.runtime.lookup.ScriptInfo;
import io.github.drompincen.scriptops.runtime.lookup.ScriptLookup;
import io.github.drompincen.scriptops.runtime.lookup.SettingsLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Get-or-compute AI help for failed executions. A successful analysis is cached on the
 * execution row; analyzer failures degrade to a fixed message and are not cached.
 */
@Service
public class AiHelpService {

    private static final Logger log = LoggerFactory.getLogger(AiHelpService.class);

    static final String ANALYSIS_UNAVAILABLE = "Error analysis could not be performed.";
    static final String ANALYSIS_FAILED = "AI analysis failed.";

    private final ExecutionLedger ledger;
    private final ScriptLookup scriptLookup;
    private final SettingsLookup settings;
    private final ErrorAnalyzer errorAnalyzer;
    private final ScriptOpsProperties properties;

    public AiHelpService(ExecutionLedger ledger,
                         ScriptLookup scriptLookup,
                         SettingsLookup settings,
                         ErrorAnalyzer errorAnalyzer,
                         ScriptOpsProperties properties) {
        this.ledger = ledger;
        this.scriptLookup = scriptLookup;
        this.settings = settings;
        this.errorAnalyzer = errorAnalyzer;
        this.properties = properties;
    }

    public AiHelpResponse getAiHelp(String executionId) {
        ExecutionDocument execution = ledger.find(executionId)
                .filter(doc -> doc.getStatus() == ExecutionStatus.FAILED)
                .orElseThrow(() -> new NotFoundException("Failed execution not found"));

        if (execution.getAiAnalysis() != null && execution.getAiSolution() != null) {
            return new AiHelpResponse(executionId, execution.getAiAnalysis(), execution.getAiSolution(), true);
        }
        if (!"true".equalsIgnoreCase(settings.get(SettingsLookup.ENABLE_AI_HELP, "true").trim())) {
            throw new PreconditionFailedException("AI help is disabled in settings");
        }
        String apiKey = settings.get(SettingsLookup.OPENAI_API_KEY, null);
        if (apiKey == null || apiKey.isBlank()) {
            throw new PreconditionFailedException("OpenAI API key not configured");
        }

        Optional<ScriptInfo> script = scriptLookup.findScript(execution.getScriptId());
        String scriptName = script.map(ScriptInfo::name).orElse(execution.getScriptId());
        String source = script.map(s -> readSource(s.path())).orElse("");
        String errorOutput = tail(execution.getOutput(), properties.getAi().getMaxErrorChars());

        try {
            ErrorAnalysis result = errorAnalyzer.analyze(apiKey, scriptName,
                    head(source, properties.getAi().getMaxSourceChars()), errorOutput);
            ledger.saveAiHelp(executionId, result.analysis(), result.solution());
            return new AiHelpResponse(executionId, result.analysis(), result.solution(), false);
        } catch (Exception e) {
            log.error("AI analysis of execution {} failed", executionId, e);
            // the cause may carry the AI service's own error text, so it stays in the log
            return new AiHelpResponse(executionId, ANALYSIS_UNAVAILABLE, ANALYSIS_FAILED, false);
        }
    }

    private String readSource(String path) {
        try {
            return Files.readString(Path.of(path));
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read script source {}: {}", path, e.getMessage());
            return "";
        }
    }

    static String head(String text, int maxChars) {
        if (text == null) return "";
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    static String tail(String text, int maxChars) {
        if (text == null) return "";
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }
}
