package io.github.drompincen.scriptops.runtime.execution;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single queue a runner worker blocks on. Injected stdin text and lines read from the process
 * arrive here in the order they were posted, followed by one END signal when output is
 * exhausted.
 */
public class ExecutionMailbox {

    enum Kind { INPUT, OUTPUT, END }

    record Signal(Kind kind, String text) {}

    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();

    void postInput(String text) {
        queue.add(new Signal(Kind.INPUT, text));
    }

    void postOutput(String line) {
        queue.add(new Signal(Kind.OUTPUT, line));
    }

    void postEnd() {
        queue.add(new Signal(Kind.END, null));
    }

    /** Next signal, or null once {@code timeout} elapses with nothing queued. */
    Signal poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
