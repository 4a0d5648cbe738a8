package io.github.drompincen.scriptops.runtime.error;

public class NoActiveExecutionException extends PreconditionFailedException {

    public NoActiveExecutionException(String executionId) {
        super("No active process for execution " + executionId);
    }
}
