package com.phillippitts.speakruntime.service.resource.event;

import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;

import java.time.Instant;
import java.util.Objects;

/**
 * Published by the registry on every resource state transition.
 *
 * @param resourceId resource id
 * @param kind resource kind
 * @param from previous state
 * @param to new state
 * @param at transition time (defaults to now)
 */
public record ResourceStateChangedEvent(
        String resourceId,
        ResourceKind kind,
        ResourceState from,
        ResourceState to,
        Instant at
) {
    public ResourceStateChangedEvent {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(to, "to");
        at = (at == null) ? Instant.now() : at;
    }
}
