package io.github.drompincen.scriptops.runtime.ai;

/**
 * Explains why a script failed. Implementations may call out to remote services and signal
 * failure with an exception.
 */
public interface ErrorAnalyzer {
    ErrorAnalysis analyze(String apiKey, String scriptName, String scriptSource, String errorOutput);
}
