package com.phillippitts.speakruntime.service.memory.event;

import java.time.Instant;

/**
 * Published when app memory grew by more than the spike ratio between two samples.
 *
 * @param previousBytes app memory of the previous sample
 * @param currentBytes app memory of the new sample
 * @param at publication time (defaults to now)
 */
public record MemoryUsageSpikeEvent(long previousBytes, long currentBytes, Instant at) {

    public MemoryUsageSpikeEvent {
        at = (at == null) ? Instant.now() : at;
    }

    public double growthRatio() {
        return previousBytes <= 0 ? 0.0 : (double) (currentBytes - previousBytes) / (double) previousBytes;
    }
}
