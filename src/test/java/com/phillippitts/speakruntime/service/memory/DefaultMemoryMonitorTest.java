package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;
import com.phillippitts.speakruntime.service.memory.event.MemoryCleanupCompletedEvent;
import com.phillippitts.speakruntime.service.memory.event.MemoryCleanupTriggeredEvent;
import com.phillippitts.speakruntime.service.memory.event.MemoryUsageSpikeEvent;
import com.phillippitts.speakruntime.service.memory.event.PressureLevelChangedEvent;
import com.phillippitts.speakruntime.testutil.EventCapturingPublisher;
import com.phillippitts.speakruntime.testutil.MutableClock;
import com.phillippitts.speakruntime.testutil.ScriptedMemorySampler;
import com.phillippitts.speakruntime.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DefaultMemoryMonitorTest {

    private MemoryMonitorProperties properties;
    private ScriptedMemorySampler sampler;
    private MemoryCleanupService cleanupService;
    private AtomicInteger cleanupPasses;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new MemoryMonitorProperties();
        properties.setEmergencyPassPause(Duration.ZERO);
        sampler = new ScriptedMemorySampler();
        cleanupService = new MemoryCleanupService(null, null);
        cleanupPasses = new AtomicInteger();
        cleanupService.registerCallback("counter", level -> cleanupPasses.incrementAndGet());
        publisher = new EventCapturingPublisher();
        clock = new MutableClock();
        scheduler = mock(TaskScheduler.class);
    }

    private DefaultMemoryMonitor monitor(Executor executor) {
        LeakDetector leakDetector = new LeakDetector(properties.getLeak(), publisher, clock);
        return new DefaultMemoryMonitor(properties, sampler, cleanupService, leakDetector,
                publisher, executor, scheduler, clock);
    }

    private DefaultMemoryMonitor monitor() {
        return monitor(new SyncExecutor());
    }

    private MemoryStatistics sampleAt(DefaultMemoryMonitor monitor, int percent) {
        sampler.usage(percent);
        return monitor.sampleNow();
    }

    @Test
    void shouldClassifySamplesAndReactOnlyToLevelChanges() {
        DefaultMemoryMonitor monitor = monitor();

        assertThat(sampleAt(monitor, 50).pressureLevel()).isEqualTo(PressureLevel.NORMAL);
        assertThat(sampleAt(monitor, 70).pressureLevel()).isEqualTo(PressureLevel.WARNING);
        assertThat(sampleAt(monitor, 92).pressureLevel()).isEqualTo(PressureLevel.CRITICAL);
        assertThat(sampleAt(monitor, 93).pressureLevel()).isEqualTo(PressureLevel.CRITICAL);

        List<PressureLevelChangedEvent> changes = publisher.eventsOf(PressureLevelChangedEvent.class);
        assertThat(changes).hasSize(2);
        assertThat(changes.get(0).previous()).isEqualTo(PressureLevel.NORMAL);
        assertThat(changes.get(0).current()).isEqualTo(PressureLevel.WARNING);
        assertThat(changes.get(1).previous()).isEqualTo(PressureLevel.WARNING);
        assertThat(changes.get(1).current()).isEqualTo(PressureLevel.CRITICAL);

        List<MemoryCleanupTriggeredEvent> triggered = publisher.eventsOf(MemoryCleanupTriggeredEvent.class);
        assertThat(triggered).extracting(MemoryCleanupTriggeredEvent::forced).containsExactly(false, true);
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(2);
        assertThat(monitor.currentLevel()).isEqualTo(PressureLevel.CRITICAL);
        assertThat(monitor.history()).hasSize(4);
    }

    @Test
    void softCleanupShouldRespectCooldownButCriticalShouldBypassIt() {
        DefaultMemoryMonitor monitor = monitor();

        sampleAt(monitor, 70);   // WARNING: soft cleanup accepted
        sampleAt(monitor, 50);   // NORMAL
        sampleAt(monitor, 70);   // WARNING again inside the cooldown: skipped
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(1);

        sampleAt(monitor, 92);   // CRITICAL: forced
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(2);

        assertThat(monitor.requestCleanup("manual", false)).isFalse();
        clock.advance(Duration.ofSeconds(31));
        assertThat(monitor.requestCleanup("manual", false)).isTrue();
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(3);
    }

    @Test
    void shouldPublishSpikeAndRequestCleanupWhenUnderPressure() {
        DefaultMemoryMonitor monitor = monitor();

        // Spike while NORMAL: event only
        sampler.set(new MemorySampler.MemoryReading(1_000, 100, 100));
        monitor.sampleNow();
        sampler.set(new MemorySampler.MemoryReading(1_000, 150, 150));
        monitor.sampleNow();
        assertThat(publisher.eventsOf(MemoryUsageSpikeEvent.class)).hasSize(1);
        assertThat(monitor.report().cleanupsPerformed()).isZero();

        // Enter WARNING without a spike: policy cleanup
        sampler.set(new MemorySampler.MemoryReading(1_000, 650, 160));
        monitor.sampleNow();
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(1);

        // Spike while WARNING after the cooldown: spike cleanup
        clock.advance(Duration.ofSeconds(31));
        sampler.set(new MemorySampler.MemoryReading(1_000, 660, 300));
        monitor.sampleNow();

        List<MemoryUsageSpikeEvent> spikes = publisher.eventsOf(MemoryUsageSpikeEvent.class);
        assertThat(spikes).hasSize(2);
        assertThat(spikes.get(1).previousBytes()).isEqualTo(160);
        assertThat(spikes.get(1).currentBytes()).isEqualTo(300);
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(2);
        assertThat(publisher.eventsOf(MemoryCleanupTriggeredEvent.class))
                .extracting(MemoryCleanupTriggeredEvent::reason)
                .containsExactly("memory pressure WARNING", "memory pressure CRITICAL");
    }

    @Test
    void emergencyShouldRunExtraPassesAndClearHistory() {
        DefaultMemoryMonitor monitor = monitor();
        sampleAt(monitor, 40);

        sampleAt(monitor, 96);

        assertThat(monitor.currentLevel()).isEqualTo(PressureLevel.EMERGENCY);
        assertThat(cleanupPasses.get()).isEqualTo(1 + properties.getEmergencyExtraPasses());
        assertThat(monitor.history()).isEmpty();
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(1);
    }

    @Test
    void shouldReportBytesFreedByCleanup() {
        cleanupService.registerCallback("shrink", level -> sampler.usage(50));
        DefaultMemoryMonitor monitor = monitor();

        sampleAt(monitor, 92);

        MemoryCleanupCompletedEvent completed = publisher.eventsOf(MemoryCleanupCompletedEvent.class).get(0);
        assertThat(completed.bytesFreed()).isEqualTo(920 - 500);
        assertThat(completed.result().callbacksRun()).isEqualTo(2);
        assertThat(completed.result().hasFailures()).isFalse();
    }

    @Test
    void shouldSkipSoftCleanupWhileAnotherIsRunning() {
        Deque<Runnable> pending = new ArrayDeque<>();
        DefaultMemoryMonitor monitor = monitor(pending::add);

        assertThat(monitor.requestCleanup("first", true)).isTrue();
        clock.advance(Duration.ofMinutes(5));
        assertThat(monitor.requestCleanup("second", false)).isFalse();

        pending.poll().run();

        assertThat(pending).isEmpty();
        assertThat(monitor.requestCleanup("third", false)).isTrue();
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(1);
    }

    @Test
    void forcedCleanupShouldRunAfterTheRunningOneFinishes() {
        Deque<Runnable> pending = new ArrayDeque<>();
        DefaultMemoryMonitor monitor = monitor(pending::add);

        assertThat(monitor.requestCleanup("first", true)).isTrue();
        assertThat(monitor.requestCleanup("second", true)).isTrue();
        assertThat(monitor.requestCleanup("third", true)).isTrue();
        assertThat(pending).hasSize(1);

        drain(pending);

        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(2);
        assertThat(publisher.eventsOf(MemoryCleanupTriggeredEvent.class))
                .extracting(MemoryCleanupTriggeredEvent::reason)
                .containsExactly("first", "second");
    }

    @Test
    void emergencyDuringSoftCleanupShouldStillRunExtraPassesAndClearHistory() {
        Deque<Runnable> pending = new ArrayDeque<>();
        DefaultMemoryMonitor monitor = monitor(pending::add);

        sampleAt(monitor, 70);
        sampleAt(monitor, 96);
        assertThat(pending).hasSize(1);

        drain(pending);

        assertThat(monitor.currentLevel()).isEqualTo(PressureLevel.EMERGENCY);
        assertThat(publisher.eventsOf(MemoryCleanupTriggeredEvent.class))
                .extracting(MemoryCleanupTriggeredEvent::reason)
                .containsExactly("memory pressure WARNING", "memory pressure EMERGENCY");
        assertThat(publisher.eventsOf(MemoryCleanupTriggeredEvent.class).get(1).level())
                .isEqualTo(PressureLevel.EMERGENCY);
        // soft pass, then the emergency pass and its extra passes
        assertThat(cleanupPasses.get()).isEqualTo(1 + 1 + properties.getEmergencyExtraPasses());
        assertThat(monitor.history()).isEmpty();
        assertThat(monitor.report().cleanupsPerformed()).isEqualTo(2);
    }

    private static void drain(Deque<Runnable> pending) {
        Runnable next;
        while ((next = pending.poll()) != null) {
            next.run();
        }
    }

    @Test
    void shouldKeepPreviousStatisticsWhenSamplerFails() {
        DefaultMemoryMonitor monitor = monitor();
        MemoryStatistics first = sampleAt(monitor, 30);

        sampler.failWith(new IllegalStateException("no MXBean"));
        MemoryStatistics second = monitor.sampleNow();

        assertThat(second).isEqualTo(first);
        assertThat(monitor.history()).hasSize(1);
    }

    @Test
    void shouldBoundHistory() {
        properties.setHistoryLimit(3);
        DefaultMemoryMonitor monitor = monitor();

        for (int i = 0; i < 5; i++) {
            sampleAt(monitor, 10 + i);
        }

        assertThat(monitor.history()).hasSize(3);
        assertThat(monitor.history().get(0).usedMemory()).isEqualTo(120);
    }

    @Test
    void startShouldScheduleSamplingAndLeakSweepOnce() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        DefaultMemoryMonitor monitor = monitor();

        monitor.start();
        monitor.start();

        assertThat(monitor.isMonitoring()).isTrue();
        // sampling tick plus leak sweep, not rescheduled by the second start
        verify(scheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));

        monitor.stop();

        assertThat(monitor.isMonitoring()).isFalse();
        verify(future, times(2)).cancel(false);
    }

    @Test
    void startShouldDoNothingWhenDisabled() {
        properties.setEnabled(false);
        DefaultMemoryMonitor monitor = monitor();

        monitor.start();

        assertThat(monitor.isMonitoring()).isFalse();
        verify(scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    void shouldExportFlatState() {
        DefaultMemoryMonitor monitor = monitor();
        monitor.trackAllocation("buffer-1", 256, "recorder");
        sampleAt(monitor, 70);

        Map<String, Object> state = monitor.exportState();

        assertThat(state)
                .containsEntry("memory.totalMemory", ScriptedMemorySampler.TOTAL)
                .containsEntry("memory.usedMemory", 700L)
                .containsEntry("memory.pressureLevel", "WARNING")
                .containsEntry("memory.cleanupsPerformed", 1L)
                .containsEntry("memory.historySize", 1)
                .containsEntry("memory.trackedAllocations", 1)
                .containsEntry("memory.trackedBytes", 256L)
                .containsEntry("memory.leakDetectionEnabled", true)
                .containsKeys("memory.sampledAt", "memory.lastCleanupTime");
    }

    @Test
    void shouldDelegateCallbackAndReclaimerRegistration() {
        DefaultMemoryMonitor monitor = monitor();
        AtomicInteger reclaimed = new AtomicInteger();

        monitor.registerCleanupCallback("cache", level -> { });
        monitor.setResourceReclaimer(() -> {
            reclaimed.incrementAndGet();
            return 0;
        });
        monitor.requestCleanup("manual", true);

        assertThat(cleanupService.callbackCount()).isEqualTo(2);
        assertThat(reclaimed.get()).isEqualTo(1);

        monitor.unregisterCleanupCallback("cache");
        assertThat(cleanupService.callbackCount()).isEqualTo(1);
    }
}
