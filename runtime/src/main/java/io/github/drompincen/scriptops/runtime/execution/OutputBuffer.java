package io.github.drompincen.scriptops.runtime.execution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Batches process output before it is written to the ledger. A batch is due once it holds more
 * than {@code thresholdChars} characters or {@code interval} has passed since the last drain.
 * Not thread-safe; owned by a single runner worker.
 */
class OutputBuffer {

    private final int thresholdChars;
    private final Duration interval;
    private final Clock clock;
    private final StringBuilder pending = new StringBuilder();
    private Instant lastDrain;

    OutputBuffer(int thresholdChars, Duration interval, Clock clock) {
        this.thresholdChars = thresholdChars;
        this.interval = interval;
        this.clock = clock;
        this.lastDrain = clock.instant();
    }

    void add(String text) {
        pending.append(text);
    }

    boolean isEmpty() {
        return pending.length() == 0;
    }

    boolean isDue() {
        if (isEmpty()) return false;
        return pending.length() > thresholdChars || !clock.instant().isBefore(lastDrain.plus(interval));
    }

    /** How long the worker may block before the pending batch becomes due by age. */
    Duration timeUntilDue() {
        if (isEmpty()) return interval;
        Duration left = Duration.between(clock.instant(), lastDrain.plus(interval));
        return left.isNegative() ? Duration.ZERO : left;
    }

    String drain() {
        String text = pending.toString();
        pending.setLength(0);
        lastDrain = clock.instant();
        return text;
    }
}
