package io.github.drompincen.scriptops.runtime.ai;

import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import io.github.drompincen.scriptops.runtime.error.ExternalFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Asks an OpenAI chat model for an "Analysis:" / "Solution:" answer. The API key comes from the
 * settings collection, so a chat model is built (and cached) per key.
 */
@Component
public class OpenAiErrorAnalyzer implements ErrorAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiErrorAnalyzer.class);

    static final String SYSTEM_PROMPT =
            "You are an AWS error-analysis assistant. "
                    + "Always respond in exactly two clearly labeled sections:\n\n"
                    + "Analysis:\n<your analysis text here>\n\n"
                    + "Solution:\n<your proposed fix here>";

    private final ScriptOpsProperties properties;
    private final Map<String, OpenAiChatModel> modelsByKey = new ConcurrentHashMap<>();

    public OpenAiErrorAnalyzer(ScriptOpsProperties properties) {
        this.properties = properties;
    }

    @Override
    public ErrorAnalysis analyze(String apiKey, String scriptName, String scriptSource, String errorOutput) {
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(SYSTEM_PROMPT),
                new UserMessage(userPrompt(scriptName, scriptSource, errorOutput))));
        try {
            var response = modelFor(apiKey).call(prompt);
            String text = response.getResult().getOutput().getText();
            log.debug("AI analysis received for script {} ({} chars)", scriptName, text != null ? text.length() : 0);
            return parse(text);
        } catch (RuntimeException e) {
            throw new ExternalFailureException("OpenAI request failed: " + e.getMessage(), e);
        }
    }

    static String userPrompt(String scriptName, String scriptSource, String errorOutput) {
        StringBuilder sb = new StringBuilder();
        sb.append("Script: ").append(scriptName != null ? scriptName : "unknown").append("\n\n");
        if (scriptSource != null && !scriptSource.isBlank()) {
            sb.append("Script source:\n").append(scriptSource).append("\n\n");
        }
        sb.append("Error output:\n\n").append(errorOutput != null ? errorOutput : "");
        return sb.toString();
    }

    /** Splits a reply on its "Solution:" label; replies without one keep everything as analysis. */
    static ErrorAnalysis parse(String reply) {
        String text = reply != null ? reply.strip() : "";
        int idx = text.indexOf("Solution:");
        if (idx < 0) {
            return new ErrorAnalysis(text.replace("Analysis:", "").strip(), "No solution provided.");
        }
        String analysis = text.substring(0, idx).replace("Analysis:", "").strip();
        String solution = text.substring(idx + "Solution:".length()).strip();
        return new ErrorAnalysis(analysis, solution.isEmpty() ? "No solution provided." : solution);
    }

    private OpenAiChatModel modelFor(String apiKey) {
        return modelsByKey.computeIfAbsent(apiKey, key -> {
            ScriptOpsProperties.Ai ai = properties.getAi();
            OpenAiApi api = OpenAiApi.builder().apiKey(key).build();
            return OpenAiChatModel.builder()
                    .openAiApi(api)
                    .defaultOptions(OpenAiChatOptions.builder()
                            .model(ai.getModel())
                            .temperature(ai.getTemperature())
                            .build())
                    .build();
        });
    }
}
