package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.domain.LifecycleEvent;
import com.phillippitts.speakruntime.domain.LifecyclePhase;
import com.phillippitts.speakruntime.domain.ResourceKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reacts to application and OS lifecycle signals by notifying registered services and driving
 * the resource registry through the matching phase transition.
 *
 * <p>Every signal, whether observed from the platform or injected manually, goes through
 * {@link #trigger(LifecycleEvent)}. Events are handled one at a time in submission order.
 */
public interface LifecycleCoordinator {

    /**
     * Queues an event.
     *
     * @return completes with the phase after the event was handled; never completes exceptionally
     */
    CompletableFuture<LifecyclePhase> trigger(LifecycleEvent event);

    LifecyclePhase currentPhase();

    boolean isTransitioning();

    /**
     * Registers a service. A service registered under an existing id replaces it. If the
     * application has already launched, {@link ServiceLifecycle#onLaunched()} is called at once.
     * Registration is refused once the runtime is terminating.
     */
    void registerService(String id, ServiceLifecycle service);

    /**
     * @return true if a service was registered under the id
     */
    boolean unregisterService(String id);

    /**
     * @return registered ids, sorted
     */
    List<String> registeredServiceIds();

    boolean isServiceRegistered(String id);

    /**
     * @return critical kinds with no READY or ACTIVE resource
     */
    List<ResourceKind> missingCriticalKinds();

    LifecycleStatistics statistics();

    Map<String, Object> exportState();

    /**
     * @return the snapshot reloaded on the last return to foreground, if any
     */
    Optional<RuntimeSnapshot> lastRestoredSnapshot();
}
