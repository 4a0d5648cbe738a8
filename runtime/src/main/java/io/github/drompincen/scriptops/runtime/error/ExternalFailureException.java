package io.github.drompincen.scriptops.runtime.error;

/**
 * A collaborator outside this process failed (process spawn, AI service). The message is logged
 * in full but callers only ever see a generic description.
 */
public class ExternalFailureException extends ScriptOpsException {

    public static final String CODE = "EXTERNAL_FAILURE";

    public ExternalFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
