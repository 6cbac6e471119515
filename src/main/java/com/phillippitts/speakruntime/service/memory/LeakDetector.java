package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.domain.TrackedAllocation;
import com.phillippitts.speakruntime.service.memory.event.PossibleLeakEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Advisory leak detector over allocations that callers opt into tracking.
 *
 * <p>The table is bounded; when full, the oldest allocation is evicted to make room. An
 * allocation still tracked after the leak threshold is reported as a possible leak. The
 * detector never frees anything itself.
 *
 * <p><b>Thread Safety:</b> all methods synchronize on the table.
 */
public class LeakDetector {

    private static final Logger LOG = LogManager.getLogger(LeakDetector.class);

    private static final int STACK_FRAMES_KEPT = 5;

    private final Map<String, TrackedAllocation> tracked = new LinkedHashMap<>();
    private final MemoryMonitorProperties.Leak properties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public LeakDetector(MemoryMonitorProperties.Leak properties, ApplicationEventPublisher publisher, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    /**
     * Starts tracking an allocation. Re-tracking an id restarts its age.
     *
     * @param originInfo where the allocation came from; when null and stack capture is enabled,
     *                   a short stack excerpt is recorded instead
     */
    public void track(String objectId, long sizeBytes, String originInfo) {
        Objects.requireNonNull(objectId, "objectId");
        if (!properties.isEnabled()) {
            return;
        }
        String origin = originInfo;
        if (origin == null && properties.isCaptureStackTraces()) {
            origin = captureOrigin();
        }
        TrackedAllocation allocation = new TrackedAllocation(objectId, clock.instant(), sizeBytes, origin);
        synchronized (tracked) {
            tracked.remove(objectId);
            while (tracked.size() >= properties.getMaxTracked()) {
                String oldest = tracked.values().stream()
                        .min(Comparator.comparing(TrackedAllocation::allocatedAt))
                        .map(TrackedAllocation::objectId)
                        .orElseThrow();
                tracked.remove(oldest);
                LOG.debug("Leak table full, evicted oldest allocation {}", oldest);
            }
            tracked.put(objectId, allocation);
        }
    }

    /**
     * @return true if the id was tracked
     */
    public boolean untrack(String objectId) {
        synchronized (tracked) {
            return tracked.remove(objectId) != null;
        }
    }

    /**
     * @return allocations older than the leak threshold, oldest first
     */
    public List<TrackedAllocation> detectLeaks() {
        Instant now = clock.instant();
        Duration threshold = properties.getThreshold();
        synchronized (tracked) {
            return tracked.values().stream()
                    .filter(a -> a.age(now).compareTo(threshold) > 0)
                    .sorted(Comparator.comparing(TrackedAllocation::allocatedAt))
                    .toList();
        }
    }

    /**
     * Detects leaks and publishes one {@link PossibleLeakEvent} per suspect.
     *
     * @return the suspects
     */
    public List<TrackedAllocation> sweep() {
        if (!properties.isEnabled()) {
            return List.of();
        }
        List<TrackedAllocation> leaks = detectLeaks();
        Instant now = clock.instant();
        for (TrackedAllocation leak : leaks) {
            LOG.warn("Possible leak: {} ({} bytes, tracked for {}s) origin={}",
                    leak.objectId(), leak.sizeBytes(), leak.age(now).toSeconds(), leak.originInfo());
            publisher.publishEvent(new PossibleLeakEvent(leak.objectId(), leak.sizeBytes(), leak.age(now),
                    leak.originInfo(), now));
        }
        return leaks;
    }

    public int trackedCount() {
        synchronized (tracked) {
            return tracked.size();
        }
    }

    public long trackedBytes() {
        synchronized (tracked) {
            return tracked.values().stream().mapToLong(TrackedAllocation::sizeBytes).sum();
        }
    }

    private static String captureOrigin() {
        // Skip getStackTrace, captureOrigin and track
        return Arrays.stream(Thread.currentThread().getStackTrace())
                .skip(3)
                .limit(STACK_FRAMES_KEPT)
                .map(StackTraceElement::toString)
                .collect(Collectors.joining(" <- "));
    }
}
