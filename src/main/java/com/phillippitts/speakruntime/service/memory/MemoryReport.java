package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;

import java.time.Instant;

/**
 * Point-in-time summary of the monitor.
 *
 * @param currentStatistics latest sample
 * @param currentLevel latest pressure level
 * @param cleanupsPerformed cleanups run since start
 * @param lastCleanupTime start of the last accepted cleanup, null if none
 * @param historySize retained samples
 * @param trackedAllocations allocations in the leak table
 * @param trackedBytes bytes in the leak table
 * @param leakDetectionEnabled whether the leak sweep runs
 * @param monitoring whether periodic sampling is scheduled
 */
public record MemoryReport(
        MemoryStatistics currentStatistics,
        PressureLevel currentLevel,
        long cleanupsPerformed,
        Instant lastCleanupTime,
        int historySize,
        int trackedAllocations,
        long trackedBytes,
        boolean leakDetectionEnabled,
        boolean monitoring
) {
}
