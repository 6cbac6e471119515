package com.phillippitts.speakruntime.domain;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a managed resource.
 *
 * <p>Resources produce one from {@code describeSelf()} to report their description,
 * memory estimate and metadata. The registry overlays the fields it owns ({@code state},
 * {@code createdAt}, {@code lastAccessedAt}) before handing the view to callers.
 *
 * @param id unique resource id
 * @param kind resource category
 * @param state lifecycle state at the time the view was taken
 * @param description human readable description
 * @param createdAt registration time
 * @param lastAccessedAt last initialize/activate/deactivate/touch time
 * @param estimatedMemoryBytes self-reported memory estimate (0 when unknown)
 * @param metadata implementation-defined diagnostics
 */
public record ResourceInfo(
        String id,
        ResourceKind kind,
        ResourceState state,
        String description,
        Instant createdAt,
        Instant lastAccessedAt,
        long estimatedMemoryBytes,
        Map<String, Object> metadata
) {
    public ResourceInfo {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (state == null) {
            state = ResourceState.UNINITIALIZED;
        }
        if (description == null) {
            description = id;
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (lastAccessedAt == null) {
            lastAccessedAt = createdAt;
        }
        if (estimatedMemoryBytes < 0) {
            estimatedMemoryBytes = 0;
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a minimal view with no timestamps, memory estimate or metadata.
     */
    public static ResourceInfo of(String id, ResourceKind kind, String description) {
        return new ResourceInfo(id, kind, ResourceState.UNINITIALIZED, description, null, null, 0L, Map.of());
    }

    /**
     * Returns a copy carrying the registry-owned fields.
     */
    public ResourceInfo withRegistryView(ResourceState state, Instant createdAt, Instant lastAccessedAt) {
        return new ResourceInfo(id, kind, state, description, createdAt, lastAccessedAt,
                estimatedMemoryBytes, metadata);
    }
}
