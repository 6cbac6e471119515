package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.domain.ResourceInfo;
import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for resources with synchronous hooks.
 *
 * <p>This class implements the Template Method pattern: the public hooks adapt the
 * {@code doXxx()} methods to the {@link ResourceManageable} contract, turning exceptions from
 * {@link #doInitialize()} and {@link #doDispose()} into failed futures. Lifecycle state stays
 * with the registry.
 *
 * <p><b>Subclass Responsibilities:</b>
 * <ul>
 *   <li>{@link #doInitialize()} - acquire models, devices or files</li>
 *   <li>{@link #doDispose()} - release everything acquired</li>
 *   <li>{@link #doActivate()} / {@link #doDeactivate()} - optional, default no-op</li>
 *   <li>{@link #estimateMemoryBytes()} / {@link #metadata()} - optional diagnostics</li>
 * </ul>
 *
 * <p>Resources that need truly asynchronous initialization should implement
 * {@link ResourceManageable} directly.
 */
public abstract class AbstractManagedResource implements ResourceManageable {

    private final String id;
    private final ResourceKind kind;
    private final String description;

    protected AbstractManagedResource(String id, ResourceKind kind, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.description = description;
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final ResourceKind kind() {
        return kind;
    }

    @Override
    public final CompletableFuture<Void> initialize() {
        try {
            doInitialize();
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public final void activate() throws Exception {
        doActivate();
    }

    @Override
    public final void deactivate() throws Exception {
        doDeactivate();
    }

    @Override
    public final CompletableFuture<Void> dispose() {
        try {
            doDispose();
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public ResourceInfo describeSelf() {
        return new ResourceInfo(id, kind, ResourceState.UNINITIALIZED, description, null, null,
                estimateMemoryBytes(), metadata());
    }

    protected abstract void doInitialize() throws Exception;

    protected abstract void doDispose() throws Exception;

    protected void doActivate() throws Exception {
        // no-op by default
    }

    protected void doDeactivate() throws Exception {
        // no-op by default
    }

    /**
     * @return best-effort estimate of the memory held by this resource, 0 when unknown
     */
    protected long estimateMemoryBytes() {
        return 0L;
    }

    protected Map<String, Object> metadata() {
        return Map.of();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", " + kind + "]";
    }
}
