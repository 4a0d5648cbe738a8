package io.github.drompincen.scriptops.runtime.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScheduleTriggerRegistryTest {

    @Mock private TaskScheduler taskScheduler;
    @Mock private Trigger trigger;
    @Captor private ArgumentCaptor<Runnable> runnableCaptor;

    private ScheduleTriggerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ScheduleTriggerRegistry(taskScheduler);
    }

    @Test
    void register_armsTriggerThatRunsTask() {
        ScheduledFuture<?> future = mockFuture();
        doReturn(future).when(taskScheduler).schedule(runnableCaptor.capture(), any(Trigger.class));
        AtomicInteger runs = new AtomicInteger();

        registry.register("sched-1", "job-1", trigger, runs::incrementAndGet);
        runnableCaptor.getValue().run();

        assertThat(runs).hasValue(1);
        assertThat(registry.isRegistered("sched-1")).isTrue();
        assertThat(registry.registeredScheduleIds()).containsExactly("sched-1");
    }

    @Test
    void register_replacesAndCancelsPreviousTrigger() {
        ScheduledFuture<?> first = mockFuture();
        ScheduledFuture<?> second = mockFuture();
        doReturn(first).doReturn(second).when(taskScheduler).schedule(runnableCaptor.capture(), any(Trigger.class));
        AtomicInteger oldRuns = new AtomicInteger();
        AtomicInteger newRuns = new AtomicInteger();

        registry.register("sched-1", "job-1", trigger, oldRuns::incrementAndGet);
        registry.register("sched-1", "job-2", trigger, newRuns::incrementAndGet);
        runnableCaptor.getAllValues().get(0).run();
        runnableCaptor.getAllValues().get(1).run();

        verify(first).cancel(false);
        verify(second, never()).cancel(false);
        assertThat(oldRuns).hasValue(0);
        assertThat(newRuns).hasValue(1);
    }

    @Test
    void staleFire_afterUnregister_doesNothing() {
        ScheduledFuture<?> future = mockFuture();
        doReturn(future).when(taskScheduler).schedule(runnableCaptor.capture(), any(Trigger.class));
        AtomicInteger runs = new AtomicInteger();
        registry.register("sched-1", "job-1", trigger, runs::incrementAndGet);

        assertThat(registry.unregister("sched-1")).isTrue();
        runnableCaptor.getValue().run();

        assertThat(runs).hasValue(0);
        verify(future).cancel(false);
        assertThat(registry.unregister("sched-1")).isFalse();
    }

    @Test
    void register_throws_whenTriggerNeverFires() {
        when(taskScheduler.schedule(any(Runnable.class), any(Trigger.class))).thenReturn(null);

        assertThatThrownBy(() -> registry.register("sched-1", "job-1", trigger, () -> {}))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.isRegistered("sched-1")).isFalse();
    }

    @Test
    void taskFailure_isContained() {
        ScheduledFuture<?> future = mockFuture();
        doReturn(future).when(taskScheduler).schedule(runnableCaptor.capture(), any(Trigger.class));
        registry.register("sched-1", "job-1", trigger, () -> {
            throw new IllegalStateException("boom");
        });

        runnableCaptor.getValue().run();

        assertThat(registry.isRegistered("sched-1")).isTrue();
    }

    @Test
    void nextFireTime_derivedFromFutureDelay() {
        ScheduledFuture<?> future = mockFuture();
        when(future.getDelay(TimeUnit.MILLISECONDS)).thenReturn(Duration.ofMinutes(30).toMillis());
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        registry.register("sched-1", "job-1", trigger, () -> {});

        Instant next = registry.nextFireTime("sched-1").orElseThrow();

        assertThat(next).isBetween(Instant.now().plus(Duration.ofMinutes(29)), Instant.now().plus(Duration.ofMinutes(31)));
        assertThat(registry.nextFireTime("other")).isEmpty();
    }

    private static ScheduledFuture<?> mockFuture() {
        return mock(ScheduledFuture.class);
    }
}
