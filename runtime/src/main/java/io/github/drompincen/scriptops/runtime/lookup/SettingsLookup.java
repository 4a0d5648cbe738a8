package io.github.drompincen.scriptops.runtime.lookup;

/**
 * Read access to operator-editable settings. Missing keys and null values resolve to the
 * supplied default.
 */
public interface SettingsLookup {

    String EXECUTION_TIMEOUT = "EXECUTION_TIMEOUT";
    String HISTORY_LIMIT = "history_limit";
    String ENABLE_AI_HELP = "enable_ai_help";
    String OPENAI_API_KEY = "openai_api_key";

    String get(String key, String defaultValue);
}
