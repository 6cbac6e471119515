package com.phillippitts.speakruntime.service.memory.event;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Advisory report of a tracked allocation older than the leak threshold.
 *
 * @param objectId tracked id
 * @param sizeBytes reported size
 * @param age time since tracking started
 * @param originInfo caller-supplied origin or captured stack excerpt
 * @param at publication time (defaults to now)
 */
public record PossibleLeakEvent(String objectId, long sizeBytes, Duration age, String originInfo, Instant at) {

    public PossibleLeakEvent {
        Objects.requireNonNull(objectId, "objectId");
        at = (at == null) ? Instant.now() : at;
    }
}
