package io.github.drompincen.scriptops.runtime.error;

public class InvalidInputException extends ScriptOpsException {

    public static final String CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(CODE, message);
    }
}
