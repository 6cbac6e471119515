package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;
import com.phillippitts.speakruntime.service.memory.event.MemoryCleanupCompletedEvent;
import com.phillippitts.speakruntime.service.memory.event.MemoryCleanupTriggeredEvent;
import com.phillippitts.speakruntime.service.memory.event.MemoryUsageSpikeEvent;
import com.phillippitts.speakruntime.service.memory.event.PressureLevelChangedEvent;
import com.phillippitts.speakruntime.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default {@link MemoryMonitor}.
 *
 * <p>Samples run on the {@link TaskScheduler}; cleanups run on the cleanup executor, one at a
 * time. The cooldown is measured from the start of the last accepted cleanup; before the first
 * cleanup it counts as elapsed. A soft request made while a cleanup is running is skipped; a
 * forced one is deferred and runs as soon as the running cleanup finishes. Deferred requests
 * merge, and an emergency request wins over a plain forced one.
 *
 * <p>Sampler or cleanup failures are logged and never stop the schedule.
 */
public class DefaultMemoryMonitor implements MemoryMonitor {

    private static final Logger LOG = LogManager.getLogger(DefaultMemoryMonitor.class);

    private final MemoryMonitorProperties properties;
    private final PressureThresholds thresholds;
    private final MemorySampler sampler;
    private final MemoryCleanupService cleanupService;
    private final LeakDetector leakDetector;
    private final ApplicationEventPublisher publisher;
    private final Executor cleanupExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final ReentrantLock sampleLock = new ReentrantLock();
    private final Deque<MemoryStatistics> history = new ArrayDeque<>();
    private volatile MemoryStatistics current;

    private final Object cleanupGate = new Object();
    private final AtomicBoolean cleanupRunning = new AtomicBoolean(false);
    private final AtomicLong cleanupsPerformed = new AtomicLong();
    private volatile Instant lastCleanupTime;
    private PendingCleanup pendingCleanup;

    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> samplingTask;
    private ScheduledFuture<?> leakSweepTask;

    public DefaultMemoryMonitor(MemoryMonitorProperties properties,
                                MemorySampler sampler,
                                MemoryCleanupService cleanupService,
                                LeakDetector leakDetector,
                                ApplicationEventPublisher publisher,
                                Executor cleanupExecutor,
                                TaskScheduler scheduler,
                                Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.thresholds = PressureThresholds.from(properties);
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.cleanupService = Objects.requireNonNull(cleanupService, "cleanupService");
        this.leakDetector = Objects.requireNonNull(leakDetector, "leakDetector");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.cleanupExecutor = Objects.requireNonNull(cleanupExecutor, "cleanupExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.current = MemoryStatistics.empty(clock.instant());
    }

    @Override
    public void start() {
        synchronized (scheduleLock) {
            if (samplingTask != null) {
                return;
            }
            if (!properties.isEnabled()) {
                LOG.info("Memory monitoring disabled (runtime.memory.enabled=false)");
                return;
            }
            samplingTask = scheduler.scheduleAtFixedRate(this::tick, properties.getSampleInterval());
            if (leakDetector.isEnabled()) {
                leakSweepTask = scheduler.scheduleAtFixedRate(this::sweepLeaks,
                        properties.getLeak().getSweepInterval());
            }
            LOG.info("Memory monitoring started: interval={}, thresholds={}, source={}",
                    properties.getSampleInterval(), thresholds, properties.getSource());
        }
    }

    @Override
    public void stop() {
        synchronized (scheduleLock) {
            if (samplingTask == null) {
                return;
            }
            samplingTask.cancel(false);
            samplingTask = null;
            if (leakSweepTask != null) {
                leakSweepTask.cancel(false);
                leakSweepTask = null;
            }
            LOG.info("Memory monitoring stopped after {} cleanup(s)", cleanupsPerformed.get());
        }
    }

    @Override
    public boolean isMonitoring() {
        synchronized (scheduleLock) {
            return samplingTask != null;
        }
    }

    private void tick() {
        try {
            sampleNow();
        } catch (RuntimeException e) {
            LOG.error("Memory sampling tick failed: {}", e.getMessage(), e);
        }
    }

    private void sweepLeaks() {
        try {
            leakDetector.sweep();
        } catch (RuntimeException e) {
            LOG.error("Leak sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public MemoryStatistics sampleNow() {
        MemorySampler.MemoryReading reading;
        try {
            reading = sampler.sample();
        } catch (RuntimeException e) {
            LOG.warn("Memory sample failed, keeping previous statistics: {}", e.getMessage());
            return current;
        }

        Instant now = clock.instant();
        PressureLevel level = thresholds.classify(reading.usageRatio());
        MemoryStatistics stats = new MemoryStatistics(reading.totalBytes(), reading.usedBytes(),
                Math.max(0L, reading.totalBytes() - reading.usedBytes()), reading.appBytes(), level, now);

        MemoryStatistics previous;
        sampleLock.lock();
        try {
            previous = current;
            current = stats;
            history.addLast(stats);
            while (history.size() > properties.getHistoryLimit()) {
                history.removeFirst();
            }
        } finally {
            sampleLock.unlock();
        }
        LOG.debug("Memory sample: {}% used, app={} bytes, level={}",
                Math.round(stats.usageRatio() * 100), stats.appMemoryUsage(), level);

        boolean cleanupAttempted = false;
        if (level != previous.pressureLevel()) {
            LOG.info("Memory pressure changed {} -> {} ({}% used)",
                    previous.pressureLevel(), level, Math.round(stats.usageRatio() * 100));
            publisher.publishEvent(new PressureLevelChangedEvent(previous.pressureLevel(), level, stats, now));
            cleanupAttempted = applyCleanupPolicy(level);
        }

        if (isSpike(previous, stats)) {
            LOG.warn("Memory usage spike: {} -> {} bytes", previous.appMemoryUsage(), stats.appMemoryUsage());
            publisher.publishEvent(new MemoryUsageSpikeEvent(previous.appMemoryUsage(), stats.appMemoryUsage(), now));
            if (level.isAtLeast(PressureLevel.WARNING) && !cleanupAttempted) {
                requestCleanup("memory usage spike", false);
            }
        }
        return stats;
    }

    private boolean applyCleanupPolicy(PressureLevel level) {
        return switch (level) {
            case NORMAL -> false;
            case WARNING -> {
                requestCleanup("memory pressure WARNING", false);
                yield true;
            }
            case CRITICAL -> {
                submitCleanup("memory pressure CRITICAL", true, false);
                yield true;
            }
            case EMERGENCY -> {
                LOG.warn("Memory pressure EMERGENCY, running emergency cleanup");
                submitCleanup("memory pressure EMERGENCY", true, true);
                yield true;
            }
        };
    }

    private boolean isSpike(MemoryStatistics previous, MemoryStatistics next) {
        long before = previous.appMemoryUsage();
        if (before <= 0) {
            return false;
        }
        double growth = (double) (next.appMemoryUsage() - before) / (double) before;
        return growth > properties.getSpikeRatio();
    }

    @Override
    public boolean requestCleanup(String reason, boolean force) {
        return submitCleanup(reason, force, false);
    }

    private boolean submitCleanup(String reason, boolean force, boolean emergency) {
        Instant now = clock.instant();
        synchronized (cleanupGate) {
            if (!force && !TimeUtils.hasElapsed(lastCleanupTime, properties.getCleanupCooldown(), now)) {
                LOG.debug("Skipping cleanup '{}': cooldown {} not elapsed since {}",
                        reason, properties.getCleanupCooldown(), lastCleanupTime);
                return false;
            }
            if (!cleanupRunning.compareAndSet(false, true)) {
                if (!force) {
                    LOG.debug("Skipping cleanup '{}': another cleanup is running", reason);
                    return false;
                }
                pendingCleanup = PendingCleanup.merge(pendingCleanup, reason, emergency);
                LOG.info("Cleanup '{}' deferred until the running cleanup finishes", reason);
                return true;
            }
            lastCleanupTime = now;
        }
        return dispatchCleanup(reason, force, emergency, now);
    }

    // Caller owns the running flag
    private boolean dispatchCleanup(String reason, boolean force, boolean emergency, Instant now) {
        PressureLevel level = current.pressureLevel();
        publisher.publishEvent(new MemoryCleanupTriggeredEvent(reason, level, force, now));
        try {
            cleanupExecutor.execute(() -> runCleanup(reason, level, emergency));
        } catch (RejectedExecutionException e) {
            synchronized (cleanupGate) {
                pendingCleanup = null;
                cleanupRunning.set(false);
            }
            LOG.warn("Cleanup '{}' rejected by executor: {}", reason, e.getMessage());
            return false;
        }
        return true;
    }

    private void runCleanup(String reason, PressureLevel level, boolean emergency) {
        long startNanos = System.nanoTime();
        try {
            long before = current.appMemoryUsage();
            LOG.info("Starting memory cleanup: {} (level {})", reason, level);
            CleanupResult result = cleanupService.runCleanup(level);
            if (emergency) {
                runExtraPasses(level);
                clearHistory();
            }
            long freed = before - readAppBytes(before);
            cleanupsPerformed.incrementAndGet();
            long elapsedMs = TimeUtils.elapsedMillis(startNanos);
            LOG.info("Memory cleanup '{}' finished in {} ms, freed {} bytes", reason, elapsedMs, freed);
            publisher.publishEvent(new MemoryCleanupCompletedEvent(reason, freed, elapsedMs, result, clock.instant()));
        } catch (RuntimeException e) {
            LOG.error("Memory cleanup '{}' failed: {}", reason, e.getMessage(), e);
        } finally {
            runPendingOrRelease();
        }
    }

    private void runPendingOrRelease() {
        PendingCleanup next;
        Instant now = clock.instant();
        synchronized (cleanupGate) {
            next = pendingCleanup;
            pendingCleanup = null;
            if (next == null) {
                cleanupRunning.set(false);
                return;
            }
            lastCleanupTime = now;
        }
        LOG.debug("Running deferred cleanup '{}'", next.reason());
        dispatchCleanup(next.reason(), true, next.emergency(), now);
    }

    /**
     * Forced cleanup requested while another one was running.
     */
    private record PendingCleanup(String reason, boolean emergency) {

        static PendingCleanup merge(PendingCleanup existing, String reason, boolean emergency) {
            if (existing == null || (emergency && !existing.emergency())) {
                return new PendingCleanup(reason, emergency);
            }
            return existing;
        }
    }

    private void runExtraPasses(PressureLevel level) {
        long pauseMs = properties.getEmergencyPassPause().toMillis();
        for (int pass = 1; pass <= properties.getEmergencyExtraPasses(); pass++) {
            if (pauseMs > 0) {
                try {
                    Thread.sleep(pauseMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Emergency cleanup interrupted after {} extra pass(es)", pass - 1);
                    return;
                }
            }
            LOG.debug("Emergency cleanup extra pass {}", pass);
            cleanupService.runCleanup(level);
        }
    }

    private long readAppBytes(long fallback) {
        try {
            return sampler.sample().appBytes();
        } catch (RuntimeException e) {
            LOG.debug("Post-cleanup sample failed: {}", e.getMessage());
            return fallback;
        }
    }

    private void clearHistory() {
        sampleLock.lock();
        try {
            history.clear();
        } finally {
            sampleLock.unlock();
        }
        LOG.info("Memory statistics history cleared");
    }

    @Override
    public MemoryStatistics currentStatistics() {
        return current;
    }

    @Override
    public PressureLevel currentLevel() {
        return current.pressureLevel();
    }

    @Override
    public List<MemoryStatistics> history() {
        sampleLock.lock();
        try {
            return List.copyOf(history);
        } finally {
            sampleLock.unlock();
        }
    }

    @Override
    public MemoryReport report() {
        MemoryStatistics stats = current;
        return new MemoryReport(stats, stats.pressureLevel(), cleanupsPerformed.get(), lastCleanupTime,
                history().size(), leakDetector.trackedCount(), leakDetector.trackedBytes(),
                leakDetector.isEnabled(), isMonitoring());
    }

    @Override
    public Map<String, Object> exportState() {
        MemoryReport report = report();
        MemoryStatistics stats = report.currentStatistics();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("memory.totalMemory", stats.totalMemory());
        state.put("memory.usedMemory", stats.usedMemory());
        state.put("memory.freeMemory", stats.freeMemory());
        state.put("memory.appMemoryUsage", stats.appMemoryUsage());
        state.put("memory.pressureLevel", report.currentLevel().name());
        state.put("memory.sampledAt", stats.timestamp().toString());
        state.put("memory.cleanupsPerformed", report.cleanupsPerformed());
        if (report.lastCleanupTime() != null) {
            state.put("memory.lastCleanupTime", report.lastCleanupTime().toString());
        }
        state.put("memory.historySize", report.historySize());
        state.put("memory.trackedAllocations", report.trackedAllocations());
        state.put("memory.trackedBytes", report.trackedBytes());
        state.put("memory.leakDetectionEnabled", report.leakDetectionEnabled());
        return state;
    }

    @Override
    public void trackAllocation(String objectId, long sizeBytes, String originInfo) {
        leakDetector.track(objectId, sizeBytes, originInfo);
    }

    @Override
    public void untrackAllocation(String objectId) {
        leakDetector.untrack(objectId);
    }

    @Override
    public void registerCleanupCallback(String name, MemoryCleanupCallback callback) {
        cleanupService.registerCallback(name, callback);
    }

    @Override
    public void unregisterCleanupCallback(String name) {
        cleanupService.unregisterCallback(name);
    }

    @Override
    public void setResourceReclaimer(ResourceReclaimer reclaimer) {
        cleanupService.setResourceReclaimer(reclaimer);
    }
}
