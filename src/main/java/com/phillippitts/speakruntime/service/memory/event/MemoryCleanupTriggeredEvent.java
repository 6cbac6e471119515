package com.phillippitts.speakruntime.service.memory.event;

import com.phillippitts.speakruntime.domain.PressureLevel;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when a cleanup is accepted, before its first step runs.
 *
 * @param reason why cleanup was requested
 * @param level pressure level at the time
 * @param forced true when the cooldown was bypassed
 * @param at publication time (defaults to now)
 */
public record MemoryCleanupTriggeredEvent(String reason, PressureLevel level, boolean forced, Instant at) {

    public MemoryCleanupTriggeredEvent {
        Objects.requireNonNull(reason, "reason");
        at = (at == null) ? Instant.now() : at;
    }
}
