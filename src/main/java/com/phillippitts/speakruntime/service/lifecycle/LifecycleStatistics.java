package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.domain.LifecyclePhase;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time summary of the coordinator.
 *
 * @param currentPhase current phase
 * @param transitioning true while a transition's steps are running
 * @param lastEventTime when the last event was handled, null before the first
 * @param registeredServices number of registered services
 * @param eventsHandled events processed since start
 * @param failedSteps transition steps or per-resource operations that failed
 * @param failedCallbacks service callbacks that threw
 * @param uptime time since the coordinator was created
 */
public record LifecycleStatistics(
        LifecyclePhase currentPhase,
        boolean transitioning,
        Instant lastEventTime,
        int registeredServices,
        long eventsHandled,
        long failedSteps,
        long failedCallbacks,
        Duration uptime
) {
}
