package io.github.drompincen.scriptops.runtime.scheduler;

import java.time.Instant;

/** Anchor an interval schedule is phase-locked to, and its first fire time. */
public record IntervalPlan(Instant anchor, Instant firstFire) {}
