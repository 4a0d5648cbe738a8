package io.github.drompincen.scriptops.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Armed triggers on the shared task scheduler, at most one per schedule id. Registering again
 * for the same schedule cancels the previous trigger; a trigger that fires after it was
 * replaced or removed does nothing.
 */
@Component
public class ScheduleTriggerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScheduleTriggerRegistry.class);

    private final TaskScheduler taskScheduler;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public ScheduleTriggerRegistry(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    public void register(String scheduleId, String jobId, Trigger trigger, Runnable task) {
        Registration registration = new Registration(scheduleId, jobId, task);
        Registration previous = registrations.put(scheduleId, registration);
        if (previous != null) {
            previous.cancel();
            log.debug("Replaced trigger {} of schedule {}", previous.jobId, scheduleId);
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(registration), trigger);
        if (future == null) {
            registrations.remove(scheduleId, registration);
            throw new IllegalStateException("Trigger " + trigger + " of schedule " + scheduleId + " never fires");
        }
        registration.future = future;
        log.info("Registered trigger {} for schedule {}", jobId, scheduleId);
    }

    public boolean unregister(String scheduleId) {
        Registration registration = registrations.remove(scheduleId);
        if (registration == null) return false;
        registration.cancel();
        log.info("Unregistered trigger {} of schedule {}", registration.jobId, scheduleId);
        return true;
    }

    public boolean isRegistered(String scheduleId) {
        return registrations.containsKey(scheduleId);
    }

    public Set<String> registeredScheduleIds() {
        return Set.copyOf(registrations.keySet());
    }

    /** When the live trigger of a schedule fires next, if one is armed. */
    public Optional<Instant> nextFireTime(String scheduleId) {
        Registration registration = registrations.get(scheduleId);
        if (registration == null || registration.future == null) return Optional.empty();
        long delayMillis = registration.future.getDelay(TimeUnit.MILLISECONDS);
        return Optional.of(Instant.now().plusMillis(Math.max(0, delayMillis)));
    }

    private void fire(Registration registration) {
        if (registrations.get(registration.scheduleId) != registration) {
            log.debug("Ignoring stale trigger {} of schedule {}", registration.jobId, registration.scheduleId);
            return;
        }
        try {
            registration.task.run();
        } catch (Exception e) {
            log.error("Trigger {} of schedule {} failed", registration.jobId, registration.scheduleId, e);
        }
    }

    private static final class Registration {
        private final String scheduleId;
        private final String jobId;
        private final Runnable task;
        private volatile ScheduledFuture<?> future;

        private Registration(String scheduleId, String jobId, Runnable task) {
            this.scheduleId = scheduleId;
            this.jobId = jobId;
            this.task = task;
        }

        private void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }
}
