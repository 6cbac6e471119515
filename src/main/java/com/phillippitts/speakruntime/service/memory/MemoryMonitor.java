package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;

import java.util.List;
import java.util.Map;

/**
 * Samples memory on a schedule, classifies pressure and triggers cleanup.
 *
 * <p>Cleanup policy on a level change: NORMAL does nothing, WARNING requests a soft cleanup
 * (skipped inside the cooldown window), CRITICAL forces one, EMERGENCY forces one followed
 * by extra passes and clears the sample history. A spike in app memory requests a soft cleanup
 * when pressure is already WARNING or higher.
 */
public interface MemoryMonitor {

    void start();

    void stop();

    boolean isMonitoring();

    /**
     * Takes a sample now and applies the cleanup policy, exactly as a scheduled tick would.
     *
     * @return the new sample, or the previous one if the sampler failed
     */
    MemoryStatistics sampleNow();

    /**
     * Requests a cleanup on the cleanup executor.
     *
     * @param force bypass the cooldown
     * @return true if the cleanup was accepted
     */
    boolean requestCleanup(String reason, boolean force);

    MemoryStatistics currentStatistics();

    PressureLevel currentLevel();

    /**
     * @return retained samples, oldest first
     */
    List<MemoryStatistics> history();

    MemoryReport report();

    Map<String, Object> exportState();

    void trackAllocation(String objectId, long sizeBytes, String originInfo);

    void untrackAllocation(String objectId);

    void registerCleanupCallback(String name, MemoryCleanupCallback callback);

    void unregisterCleanupCallback(String name);

    void setResourceReclaimer(ResourceReclaimer reclaimer);
}
