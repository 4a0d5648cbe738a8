package io.github.drompincen.scriptops.runtime.error;

public class ExecutionNotFoundException extends NotFoundException {

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
    }
}
