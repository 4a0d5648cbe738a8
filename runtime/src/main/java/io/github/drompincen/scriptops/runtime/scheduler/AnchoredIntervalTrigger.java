package io.github.drompincen.scriptops.runtime.scheduler;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Fires at {@code firstFire}, then on every later point of the {@code anchor + k * interval}
 * grid, so a late run never shifts the phase.
 */
public class AnchoredIntervalTrigger implements Trigger {

    private final Instant anchor;
    private final Duration interval;
    private final Instant firstFire;

    public AnchoredIntervalTrigger(Instant anchor, Duration interval, Instant firstFire) {
        this.anchor = anchor;
        this.interval = interval;
        this.firstFire = firstFire;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant last = triggerContext.lastScheduledExecution();
        if (last == null) {
            return firstFire;
        }
        return NextRunCalculator.alignedAfter(anchor, interval, last, Duration.ofMillis(1));
    }

    @Override
    public String toString() {
        return "AnchoredIntervalTrigger[anchor=" + anchor + ", interval=" + interval + "]";
    }
}
