package com.phillippitts.speakruntime.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable memory sample.
 *
 * @param totalMemory bytes available to the sampled pool
 * @param usedMemory bytes in use in the sampled pool
 * @param freeMemory {@code totalMemory - usedMemory}
 * @param appMemoryUsage bytes attributed to this process
 * @param pressureLevel level derived from {@code usedMemory / totalMemory}
 * @param timestamp sample time
 */
public record MemoryStatistics(
        long totalMemory,
        long usedMemory,
        long freeMemory,
        long appMemoryUsage,
        PressureLevel pressureLevel,
        Instant timestamp
) {
    public MemoryStatistics {
        Objects.requireNonNull(pressureLevel, "pressureLevel");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Sample used before the first tick.
     */
    public static MemoryStatistics empty(Instant at) {
        return new MemoryStatistics(0L, 0L, 0L, 0L, PressureLevel.NORMAL, at);
    }

    /**
     * @return used/total ratio, or 0 when the total is unknown
     */
    public double usageRatio() {
        return totalMemory <= 0 ? 0.0 : (double) usedMemory / (double) totalMemory;
    }

    /**
     * @return app/total ratio, or 0 when the total is unknown
     */
    public double appUsageRatio() {
        return totalMemory <= 0 ? 0.0 : (double) appMemoryUsage / (double) totalMemory;
    }
}
