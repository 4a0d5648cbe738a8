package io.github.drompincen.scriptops.runtime.execution;

import io.github.drompincen.scriptops.protocol.api.ExecutionStatus;

/**
 * Terminal status and banner for a process exit code. Exit values above 128 are how the JVM
 * reports a death by signal on Unix; those are failures, never cancellations.
 */
record ExecutionOutcome(ExecutionStatus status, String banner) {

    private static final int SIGNAL_BASE = 128;
    private static final int MAX_SIGNAL = 64;

    static ExecutionOutcome classify(int exitCode) {
        if (exitCode == 0) {
            return new ExecutionOutcome(ExecutionStatus.SUCCESS, ExecutionBanners.COMPLETED);
        }
        if (exitCode > SIGNAL_BASE && exitCode <= SIGNAL_BASE + MAX_SIGNAL) {
            return new ExecutionOutcome(ExecutionStatus.FAILED,
                    ExecutionBanners.killedBySignal(exitCode - SIGNAL_BASE));
        }
        return new ExecutionOutcome(ExecutionStatus.FAILED, ExecutionBanners.failedWithCode(exitCode));
    }
}
