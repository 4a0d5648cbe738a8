package io.github.drompincen.scriptops.runtime.error;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;

public class ExecutionNotRunningException extends PreconditionFailedException {

    public ExecutionNotRunningException(String executionId, ExecutionStatus status) {
        super("Execution " + executionId + " is not running (status " + status + ")");
    }
}
