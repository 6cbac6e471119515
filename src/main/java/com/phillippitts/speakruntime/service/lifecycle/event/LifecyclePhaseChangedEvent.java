package com.phillippitts.speakruntime.service.lifecycle.event;

import com.phillippitts.speakruntime.domain.LifecycleEvent;
import com.phillippitts.speakruntime.domain.LifecyclePhase;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when the application phase changes.
 *
 * @param from previous phase
 * @param to new phase
 * @param cause event that caused the change
 * @param at change time (defaults to now)
 */
public record LifecyclePhaseChangedEvent(LifecyclePhase from, LifecyclePhase to, LifecycleEvent cause, Instant at) {

    public LifecyclePhaseChangedEvent {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        at = (at == null) ? Instant.now() : at;
    }
}
