package com.phillippitts.speakruntime.service.events;

import com.phillippitts.speakruntime.domain.ResourceState;
import com.phillippitts.speakruntime.service.memory.event.MemoryCleanupCompletedEvent;
import com.phillippitts.speakruntime.service.memory.event.MemoryUsageSpikeEvent;
import com.phillippitts.speakruntime.service.memory.event.PossibleLeakEvent;
import com.phillippitts.speakruntime.service.resource.event.ResourceStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log of runtime warnings. Throttled per key to avoid log spam when the same
 * leak or failing resource is reported on every sweep.
 */
@Component
class RuntimeEventsListener {
    private static final Logger LOG = LogManager.getLogger(RuntimeEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    RuntimeEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onPossibleLeak(PossibleLeakEvent e) {
        if (shouldLog("leak-" + e.objectId())) {
            LOG.warn("Possible leak: object={}, size={} bytes, age={}s, origin={}",
                    e.objectId(), e.sizeBytes(), e.age().toSeconds(), e.originInfo());
        }
    }

    @EventListener
    void onMemorySpike(MemoryUsageSpikeEvent e) {
        if (shouldLog("spike")) {
            LOG.warn("App memory spiked {} -> {} bytes (+{}%)",
                    e.previousBytes(), e.currentBytes(), Math.round(e.growthRatio() * 100));
        }
    }

    @EventListener
    void onResourceStateChanged(ResourceStateChangedEvent e) {
        if (e.to() == ResourceState.ERROR && shouldLog("error-" + e.resourceId())) {
            LOG.warn("Resource {} ({}) entered ERROR from {}", e.resourceId(), e.kind(), e.from());
        }
    }

    @EventListener
    void onCleanupCompleted(MemoryCleanupCompletedEvent e) {
        if (e.result() != null && e.result().hasFailures() && shouldLog("cleanup-failures")) {
            LOG.warn("Memory cleanup ({}) finished with failed steps: {}", e.reason(), e.result().failedSteps());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
