package com.phillippitts.speakruntime.service.memory.event;

import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a sample's pressure level differs from the previous sample's.
 *
 * @param previous level of the previous sample
 * @param current level of the new sample
 * @param statistics the new sample
 * @param at publication time (defaults to now)
 */
public record PressureLevelChangedEvent(
        PressureLevel previous,
        PressureLevel current,
        MemoryStatistics statistics,
        Instant at
) {
    public PressureLevelChangedEvent {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        at = (at == null) ? Instant.now() : at;
    }

    public boolean isEscalation() {
        return current.compareTo(previous) > 0;
    }
}
