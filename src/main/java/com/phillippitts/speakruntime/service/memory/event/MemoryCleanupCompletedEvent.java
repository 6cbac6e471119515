package com.phillippitts.speakruntime.service.memory.event;

import com.phillippitts.speakruntime.service.memory.CleanupResult;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a cleanup finished.
 *
 * @param reason why cleanup was requested
 * @param bytesFreed app memory before minus after (negative when usage grew meanwhile)
 * @param durationMs wall time of the cleanup including extra emergency passes
 * @param result outcome of the first pass
 * @param at publication time (defaults to now)
 */
public record MemoryCleanupCompletedEvent(String reason, long bytesFreed, long durationMs,
                                          CleanupResult result, Instant at) {

    public MemoryCleanupCompletedEvent {
        Objects.requireNonNull(reason, "reason");
        at = (at == null) ? Instant.now() : at;
    }
}
