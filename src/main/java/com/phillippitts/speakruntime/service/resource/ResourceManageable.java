package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.domain.ResourceInfo;
import com.phillippitts.speakruntime.domain.ResourceKind;

import java.util.concurrent.CompletableFuture;

/**
 * Contract for long-lived objects owned by the {@link ResourceRegistry}.
 *
 * <p>The registry owns the lifecycle state; implementations only provide the hooks. Hooks are
 * never called concurrently for one resource by the registry, but callers must not issue
 * overlapping lifecycle operations for the same id (see {@link ResourceRegistry}).
 *
 * <p>{@link #initialize()} and {@link #dispose()} may complete asynchronously. A {@code null}
 * future is treated as already completed. A hook that throws synchronously is treated the same
 * as one whose future completes exceptionally.
 *
 * @see AbstractManagedResource
 */
public interface ResourceManageable {

    /**
     * @return unique, stable id
     */
    String id();

    ResourceKind kind();

    /**
     * Acquires whatever the resource needs (models, devices, files).
     */
    CompletableFuture<Void> initialize();

    /**
     * Starts using the acquired resources. Called only when the resource is READY.
     *
     * @throws Exception if the resource cannot be activated; it stays READY
     */
    void activate() throws Exception;

    /**
     * Stops using the acquired resources without releasing them. Called only when ACTIVE.
     *
     * @throws Exception if the resource cannot be deactivated; it moves to ERROR
     */
    void deactivate() throws Exception;

    /**
     * Releases everything acquired by {@link #initialize()}.
     */
    CompletableFuture<Void> dispose();

    /**
     * Self-reported description, memory estimate and metadata. The registry overlays the
     * state and timestamps it owns.
     */
    ResourceInfo describeSelf();
}
