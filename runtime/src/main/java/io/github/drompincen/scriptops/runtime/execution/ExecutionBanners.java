package io.github.drompincen.scriptops.runtime.execution;

/**
 * System lines written into execution output. Everything except the start banner begins on a
 * fresh line.
 */
public final class ExecutionBanners {

    public static final String STARTING = "[SYSTEM] Starting script execution...\n";
    public static final String COMPLETED = "\n[SYSTEM] Script execution completed successfully";
    public static final String TERMINATED_BY_USER = "\n[SYSTEM] Script execution was terminated by user";
    public static final String CANCEL_REQUESTED =
            "\n[SYSTEM] Cancellation requested by user - terminating process...";
    public static final String PROCESS_TERMINATED = "\n[SYSTEM] Process terminated successfully.";
    public static final String TIMED_OUT =
            "\n[SYSTEM] Script execution timed out and was automatically terminated.";

    private ExecutionBanners() {}

    public static String failedWithCode(int exitCode) {
        return "\n[SYSTEM] Script execution failed with return code " + exitCode;
    }

    public static String killedBySignal(int signal) {
        return "\n[SYSTEM] Script execution was terminated unexpectedly (signal " + signal + ")";
    }

    public static String error(String message) {
        return "\n[SYSTEM] Error running script: " + message;
    }

    public static String inputEcho(String text) {
        return "[INPUT]: " + text;
    }
}
