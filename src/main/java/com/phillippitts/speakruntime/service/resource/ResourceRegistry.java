package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.domain.ResourceInfo;
import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Owns every long-lived resource of the process, its dependency edges and its lifecycle state.
 *
 * <p><b>State machine:</b>
 * <pre>
 * UNINITIALIZED → INITIALIZING → READY ⇄ ACTIVE → DISPOSING → DISPOSED
 * </pre>
 * ERROR is entered when an initialize, deactivate or dispose hook fails and is only left by
 * disposing the resource.
 *
 * <p><b>Ordering:</b> {@link #initialize(String)} brings every transitive dependency to READY
 * before the resource itself; {@link #dispose(String)} disposes every dependent first. No other
 * ordering is guaranteed.
 *
 * <p><b>Concurrency:</b> queries are safe at any time. Callers must not issue overlapping
 * lifecycle operations for the same id; if they do, the loser fails with
 * {@link com.phillippitts.speakruntime.exception.InvalidResourceStateException}.
 *
 * <p>Activation does not require dependencies to be ACTIVE, only initialized.
 */
public interface ResourceRegistry {

    /**
     * Registers a resource in UNINITIALIZED state.
     *
     * @param dependencies ids that must already be registered, initialized first in the given order
     * @throws com.phillippitts.speakruntime.exception.ResourceAlreadyRegisteredException if the id is taken
     * @throws com.phillippitts.speakruntime.exception.DependencyNotMetException if a dependency is missing
     * @throws com.phillippitts.speakruntime.exception.CircularDependencyException if an edge would close a cycle
     */
    void register(ResourceManageable resource, Set<String> dependencies);

    default void register(ResourceManageable resource) {
        register(resource, Set.of());
    }

    /**
     * Initializes the resource after its not-yet-initialized dependencies. Completes exceptionally
     * with {@code ResourceNotFoundException}, {@code InvalidResourceStateException} or
     * {@code ResourceInitializationException}.
     */
    CompletableFuture<Void> initialize(String id);

    /**
     * READY → ACTIVE.
     *
     * @throws com.phillippitts.speakruntime.exception.ResourceActivationException if the hook fails
     */
    void activate(String id);

    /**
     * ACTIVE → READY.
     *
     * @throws com.phillippitts.speakruntime.exception.ResourceActivationException if the hook fails
     */
    void deactivate(String id);

    /**
     * Disposes the resource, disposing its dependents first, and removes it with its edges.
     * Completes exceptionally with {@code ResourceNotFoundException},
     * {@code InvalidResourceStateException}, {@code ResourceDisposalException} or
     * {@code DisposalDepthExceededException}.
     */
    CompletableFuture<Void> dispose(String id);

    /**
     * Records an access without changing state.
     */
    void touch(String id);

    /**
     * Disposes up to {@code limit} resources that are neither ACTIVE nor mid-transition, have
     * no dependents and were last accessed more than {@code idleWindow} ago. Failures are
     * logged and skipped.
     *
     * @return number of resources disposed
     */
    int evictIdle(Duration idleWindow, int limit);

    Optional<ResourceManageable> get(String id);

    Optional<ResourceInfo> describe(String id);

    boolean contains(String id);

    List<ResourceInfo> listAll();

    List<ResourceInfo> listByKind(ResourceKind kind);

    List<ResourceInfo> listByState(ResourceState state);

    Set<String> dependenciesOf(String id);

    Set<String> dependentsOf(String id);

    ResourceRegistryStatistics statistics();

    /**
     * Flat, string-keyed summary used in the runtime snapshot.
     */
    Map<String, Object> exportState();
}
