package io.github.drompincen.scriptops.runtime.error;

/**
 * Base class for failures that are reported back to the caller with a stable error code.
 */
public class ScriptOpsException extends RuntimeException {

    private final String errorCode;

    public ScriptOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ScriptOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
