package com.phillippitts.speakruntime.service.memory;

/**
 * Source of raw memory readings. The monitor derives pressure from them.
 */
@FunctionalInterface
public interface MemorySampler {

    /**
     * Takes one reading.
     *
     * @throws RuntimeException if the platform cannot report memory; the monitor logs and skips the tick
     */
    MemoryReading sample();

    /**
     * Raw reading.
     *
     * @param totalBytes bytes available to the measured pool
     * @param usedBytes bytes in use in the measured pool
     * @param appBytes bytes attributed to this process
     */
    record MemoryReading(long totalBytes, long usedBytes, long appBytes) {
        public MemoryReading {
            if (totalBytes < 0 || usedBytes < 0 || appBytes < 0) {
                throw new IllegalArgumentException("Memory readings must be non-negative");
            }
        }

        public double usageRatio() {
            return totalBytes == 0 ? 0.0 : (double) usedBytes / (double) totalBytes;
        }
    }
}
