package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.domain.ResourceState;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Registry-owned bookkeeping for one resource. All fields are guarded by the registry lock.
 */
final class ResourceEntry {

    final ResourceManageable resource;
    final Instant createdAt;
    Instant lastAccessedAt;
    ResourceState state = ResourceState.UNINITIALIZED;

    /** Set while INITIALIZING so dependents can join the in-flight initialization. */
    CompletableFuture<Void> initialization;

    /** Set while an activate/deactivate hook runs. */
    boolean hookRunning;

    ResourceEntry(ResourceManageable resource, Instant createdAt) {
        this.resource = resource;
        this.createdAt = createdAt;
        this.lastAccessedAt = createdAt;
    }

    String id() {
        return resource.id();
    }
}
