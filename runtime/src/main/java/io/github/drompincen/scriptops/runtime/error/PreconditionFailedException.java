package io.github.drompincen.scriptops.runtime.error;

public class PreconditionFailedException extends ScriptOpsException {

    public static final String CODE = "PRECONDITION_FAILED";

    public PreconditionFailedException(String message) {
        super(CODE, message);
    }
}
