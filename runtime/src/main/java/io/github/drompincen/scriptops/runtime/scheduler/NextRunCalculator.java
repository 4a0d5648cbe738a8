package io.github.drompincen.scriptops.runtime.scheduler;

import io.github.drompincen.scriptops.runtime.config.ScriptOpsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Next-fire arithmetic for both schedule types. Interval schedules stay on the grid
 * {@code anchor + k * interval} across restarts.
 */
@Component
public class NextRunCalculator {

    /** A fire closer than this to "now" is skipped in favour of the following period. */
    static final Duration MINIMUM_LEAD = Duration.ofSeconds(10);

    private final Clock clock;

    @Autowired
    public NextRunCalculator(ScriptOpsProperties properties) {
        this(Clock.system(properties.zoneId()));
    }

    public NextRunCalculator(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    /** Today at {@code hhmm} in the configured zone if still ahead, otherwise tomorrow. */
    public Instant nextDaily(String hhmm) {
        LocalTime time = LocalTime.parse(hhmm);
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime candidate = now.toLocalDate().atTime(time).atZone(clock.getZone());
        if (!candidate.isAfter(now)) {
            candidate = now.toLocalDate().plusDays(1).atTime(time).atZone(clock.getZone());
        }
        return candidate.toInstant();
    }

    public Trigger dailyTrigger(String hhmm) {
        LocalTime time = LocalTime.parse(hhmm);
        return new CronTrigger(String.format("0 %d %d * * *", time.getMinute(), time.getHour()), clock.getZone());
    }

    /**
     * Plans an interval schedule. An existing anchor keeps its phase; without one, a stored
     * {@code nextRun} still in the future is honoured and the anchor derived from it; otherwise
     * the schedule starts fresh from now.
     */
    public IntervalPlan planInterval(Duration interval, Instant anchor, Instant storedNextRun) {
        Instant now = clock.instant();
        if (anchor != null) {
            return new IntervalPlan(anchor, alignedAfter(anchor, interval, now, MINIMUM_LEAD));
        }
        if (storedNextRun != null && storedNextRun.isAfter(now)) {
            return new IntervalPlan(storedNextRun.minus(interval), storedNextRun);
        }
        return new IntervalPlan(now, now.plus(interval));
    }

    /**
     * First grid point {@code anchor + k * interval} that is at least {@code lead} after
     * {@code after}.
     */
    static Instant alignedAfter(Instant anchor, Duration interval, Instant after, Duration lead) {
        long intervalMillis = interval.toMillis();
        long elapsed = Duration.between(anchor, after).toMillis();
        long remaining = intervalMillis - Math.floorMod(elapsed, intervalMillis);
        if (remaining < lead.toMillis()) {
            remaining += intervalMillis;
        }
        return after.plusMillis(remaining);
    }
}
