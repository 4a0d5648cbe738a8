package io.github.drompincen.scriptops.runtime.error;

public class NotFoundException extends ScriptOpsException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }
}
