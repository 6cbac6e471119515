package com.phillippitts.speakruntime.service.resource;

import com.phillippitts.speakruntime.config.properties.ResourceRegistryProperties;
import com.phillippitts.speakruntime.domain.ResourceInfo;
import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;
import com.phillippitts.speakruntime.exception.CircularDependencyException;
import com.phillippitts.speakruntime.exception.DependencyNotMetException;
import com.phillippitts.speakruntime.exception.DisposalDepthExceededException;
import com.phillippitts.speakruntime.exception.InvalidResourceStateException;
import com.phillippitts.speakruntime.exception.ResourceActivationException;
import com.phillippitts.speakruntime.exception.ResourceAlreadyRegisteredException;
import com.phillippitts.speakruntime.exception.ResourceDisposalException;
import com.phillippitts.speakruntime.exception.ResourceInitializationException;
import com.phillippitts.speakruntime.exception.ResourceNotFoundException;
import com.phillippitts.speakruntime.service.resource.event.ResourceStateChangedEvent;
import com.phillippitts.speakruntime.util.Futures;
import com.phillippitts.speakruntime.util.SoftTimeouts;
import com.phillippitts.speakruntime.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Default {@link ResourceRegistry}.
 *
 * <p>One {@link ReentrantReadWriteLock} guards the entry map, the dependency graph and every
 * entry's state fields. Hooks always run outside the lock: a state is claimed under the write
 * lock (check-and-set), the hook runs, and the outcome is written back under the write lock.
 *
 * <p>Initialize and dispose hooks run on the injected executor. Hooks that run longer than
 * {@code runtime.registry.hook-soft-timeout} are logged and left running.
 */
public class DefaultResourceRegistry implements ResourceRegistry {

    private static final Logger LOG = LogManager.getLogger(DefaultResourceRegistry.class);

    static final String MDC_RESOURCE_ID = "resourceId";

    private final Map<String, ResourceEntry> entries = new LinkedHashMap<>();
    private final DependencyGraph graph = new DependencyGraph();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ResourceRegistryProperties properties;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile Instant lastEvictionTime;

    public DefaultResourceRegistry(ResourceRegistryProperties properties,
                                   Executor executor,
                                   ApplicationEventPublisher publisher,
                                   Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void register(ResourceManageable resource, Set<String> dependencies) {
        Objects.requireNonNull(resource, "resource");
        String id = Objects.requireNonNull(resource.id(), "resource id");
        Set<String> deps = dependencies == null ? Set.of() : new LinkedHashSet<>(dependencies);

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, id)) {
            lock.writeLock().lock();
            try {
                if (entries.containsKey(id)) {
                    throw new ResourceAlreadyRegisteredException(id);
                }
                if (deps.contains(id)) {
                    throw new CircularDependencyException(id, id);
                }
                List<String> missing = deps.stream().filter(d -> !entries.containsKey(d)).toList();
                if (!missing.isEmpty()) {
                    throw new DependencyNotMetException(id, missing);
                }
                graph.add(id, deps);
                entries.put(id, new ResourceEntry(resource, clock.instant()));
            } finally {
                lock.writeLock().unlock();
            }
            LOG.info("Registered resource {} (kind={}, dependencies={})", id, resource.kind(), deps);
        }
    }

    // ---------------------------------------------------------------- initialize

    @Override
    public CompletableFuture<Void> initialize(String id) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, id)) {
            ResourceEntry entry;
            CompletableFuture<Void> result;
            lock.writeLock().lock();
            try {
                entry = entries.get(id);
                if (entry == null) {
                    return CompletableFuture.failedFuture(new ResourceNotFoundException(id));
                }
                if (entry.state != ResourceState.UNINITIALIZED) {
                    return CompletableFuture.failedFuture(
                            new InvalidResourceStateException(id, "initialize", entry.state));
                }
                result = beginInitialization(entry);
            } finally {
                lock.writeLock().unlock();
            }
            publishStateChange(entry, ResourceState.UNINITIALIZED, ResourceState.INITIALIZING);
            runInitialization(entry, result);
            return result;
        }
    }

    // Caller holds the write lock
    private CompletableFuture<Void> beginInitialization(ResourceEntry entry) {
        entry.state = ResourceState.INITIALIZING;
        entry.lastAccessedAt = clock.instant();
        entry.initialization = new CompletableFuture<>();
        return entry.initialization;
    }

    private void runInitialization(ResourceEntry entry, CompletableFuture<Void> result) {
        String id = entry.id();
        List<String> deps = readLocked(() -> new ArrayList<>(graph.dependenciesOf(id)));
        long startNanos = System.nanoTime();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String dep : deps) {
            chain = chain.thenCompose(v -> ensureDependencyInitialized(dep, id));
        }
        chain.thenComposeAsync(v -> SoftTimeouts.watch(
                        Futures.invokeHook(entry.resource::initialize),
                        properties.getHookSoftTimeout(), "initialize hook of " + id), executor)
                .whenComplete((v, error) -> completeInitialization(entry, result, error, startNanos));
    }

    private CompletableFuture<Void> ensureDependencyInitialized(String depId, String dependentId) {
        ResourceEntry dep;
        CompletableFuture<Void> started = null;
        lock.writeLock().lock();
        try {
            dep = entries.get(depId);
            if (dep == null) {
                return CompletableFuture.failedFuture(new ResourceNotFoundException(depId));
            }
            switch (dep.state) {
                case READY, ACTIVE -> {
                    return CompletableFuture.completedFuture(null);
                }
                case INITIALIZING -> {
                    LOG.debug("Joining in-flight initialization of {} for {}", depId, dependentId);
                    return dep.initialization;
                }
                case UNINITIALIZED -> started = beginInitialization(dep);
                default -> {
                    return CompletableFuture.failedFuture(new InvalidResourceStateException(
                            depId, "initialize as dependency of " + dependentId, dep.state));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debug("Initializing dependency {} of {}", depId, dependentId);
        publishStateChange(dep, ResourceState.UNINITIALIZED, ResourceState.INITIALIZING);
        runInitialization(dep, started);
        return started;
    }

    private void completeInitialization(ResourceEntry entry, CompletableFuture<Void> result,
                                        Throwable error, long startNanos) {
        String id = entry.id();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, id)) {
            ResourceState to = error == null ? ResourceState.READY : ResourceState.ERROR;
            lock.writeLock().lock();
            try {
                entry.state = to;
                entry.initialization = null;
                entry.lastAccessedAt = clock.instant();
            } finally {
                lock.writeLock().unlock();
            }
            publishStateChange(entry, ResourceState.INITIALIZING, to);

            if (error == null) {
                LOG.info("Resource {} initialized in {} ms", id, TimeUtils.elapsedMillis(startNanos));
                result.complete(null);
            } else {
                Throwable cause = Futures.unwrap(error);
                LOG.error("Resource {} failed to initialize: {}", id, cause.getMessage(), cause);
                result.completeExceptionally(new ResourceInitializationException(id, cause));
            }
        }
    }

    // ---------------------------------------------------------------- activate / deactivate

    @Override
    public void activate(String id) {
        runSyncHook(id, "activate", ResourceState.READY, ResourceState.ACTIVE,
                ResourceState.READY, ResourceManageable::activate);
    }

    @Override
    public void deactivate(String id) {
        runSyncHook(id, "deactivate", ResourceState.ACTIVE, ResourceState.READY,
                ResourceState.ERROR, ResourceManageable::deactivate);
    }

    @FunctionalInterface
    private interface SyncHook {
        void run(ResourceManageable resource) throws Exception;
    }

    private void runSyncHook(String id, String operation, ResourceState from, ResourceState to,
                             ResourceState onFailure, SyncHook hook) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, id)) {
            ResourceEntry entry;
            lock.writeLock().lock();
            try {
                entry = requireEntry(id);
                if (entry.state != from || entry.hookRunning) {
                    throw new InvalidResourceStateException(id, operation, entry.state);
                }
                entry.hookRunning = true;
            } finally {
                lock.writeLock().unlock();
            }

            Exception failure = null;
            try {
                hook.run(entry.resource);
            } catch (Exception e) {
                failure = e;
            }

            ResourceState next = failure == null ? to : onFailure;
            lock.writeLock().lock();
            try {
                entry.hookRunning = false;
                entry.state = next;
                entry.lastAccessedAt = clock.instant();
            } finally {
                lock.writeLock().unlock();
            }
            if (next != from) {
                publishStateChange(entry, from, next);
            }

            if (failure != null) {
                LOG.error("Resource {} {} hook failed, now {}: {}", id, operation, next, failure.getMessage(), failure);
                throw new ResourceActivationException(id, operation, failure);
            }
            LOG.info("Resource {} {} -> {}", id, from, to);
        }
    }

    // ---------------------------------------------------------------- dispose

    @Override
    public CompletableFuture<Void> dispose(String id) {
        return CompletableFuture.runAsync(() -> disposeWithDependents(id), executor);
    }

    /**
     * Iterative work-list disposal. A candidate with live dependents is re-queued behind them;
     * processed ids are skipped. The pass budget bounds the loop even if the graph were cyclic.
     */
    void disposeWithDependents(String rootId) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, rootId)) {
            if (!contains(rootId)) {
                throw new ResourceNotFoundException(rootId);
            }
            int maxPasses = properties.getMaxDisposalPasses();
            Deque<String> work = new ArrayDeque<>();
            Set<String> processed = new HashSet<>();
            work.add(rootId);
            int passes = 0;

            while (!work.isEmpty()) {
                if (passes >= maxPasses) {
                    List<String> unresolved = new ArrayList<>(new LinkedHashSet<>(work));
                    LOG.error("Disposal of {} exceeded {} passes, unresolved: {}", rootId, maxPasses, unresolved);
                    throw new DisposalDepthExceededException(rootId, maxPasses, unresolved);
                }
                passes++;
                String candidate = work.pollFirst();
                if (processed.contains(candidate)) {
                    continue;
                }

                List<String> dependents;
                lock.readLock().lock();
                try {
                    if (!entries.containsKey(candidate)) {
                        processed.add(candidate);
                        continue;
                    }
                    dependents = graph.dependentsOf(candidate);
                } finally {
                    lock.readLock().unlock();
                }

                if (!dependents.isEmpty()) {
                    LOG.debug("Deferring disposal of {} until dependents {} are disposed", candidate, dependents);
                    work.removeAll(dependents);
                    for (int i = dependents.size() - 1; i >= 0; i--) {
                        work.addFirst(dependents.get(i));
                    }
                    work.addLast(candidate);
                    continue;
                }

                disposeSingle(candidate);
                processed.add(candidate);
            }
            LOG.debug("Disposal of {} finished in {} pass(es)", rootId, passes);
        }
    }

    private void disposeSingle(String id) {
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_RESOURCE_ID, id)) {
            ResourceEntry entry;
            ResourceState from;
            lock.writeLock().lock();
            try {
                entry = entries.get(id);
                if (entry == null) {
                    return;
                }
                from = entry.state;
                if (from == ResourceState.INITIALIZING || from == ResourceState.DISPOSING
                        || from == ResourceState.DISPOSED || entry.hookRunning) {
                    throw new InvalidResourceStateException(id, "dispose", from);
                }
                entry.state = ResourceState.DISPOSING;
            } finally {
                lock.writeLock().unlock();
            }
            publishStateChange(entry, from, ResourceState.DISPOSING);

            long startNanos = System.nanoTime();
            try {
                SoftTimeouts.watch(Futures.invokeHook(entry.resource::dispose),
                        properties.getHookSoftTimeout(), "dispose hook of " + id).join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = Futures.unwrap(e);
                lock.writeLock().lock();
                try {
                    entry.state = ResourceState.ERROR;
                } finally {
                    lock.writeLock().unlock();
                }
                publishStateChange(entry, ResourceState.DISPOSING, ResourceState.ERROR);
                LOG.error("Failed to dispose resource {}: {}", id, cause.getMessage(), cause);
                throw new ResourceDisposalException(id, cause);
            }

            lock.writeLock().lock();
            try {
                entry.state = ResourceState.DISPOSED;
                entries.remove(id);
                graph.remove(id);
            } finally {
                lock.writeLock().unlock();
            }
            publishStateChange(entry, ResourceState.DISPOSING, ResourceState.DISPOSED);
            LOG.info("Disposed resource {} in {} ms", id, TimeUtils.elapsedMillis(startNanos));
        }
    }

    // ---------------------------------------------------------------- access / eviction

    @Override
    public void touch(String id) {
        lock.writeLock().lock();
        try {
            requireEntry(id).lastAccessedAt = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int evictIdle(Duration idleWindow, int limit) {
        Instant now = clock.instant();
        List<String> candidates;
        lock.readLock().lock();
        try {
            candidates = entries.values().stream()
                    .filter(e -> e.state != ResourceState.ACTIVE && !e.state.isTransient() && !e.hookRunning)
                    .filter(e -> Duration.between(e.lastAccessedAt, now).compareTo(idleWindow) > 0)
                    .filter(e -> graph.dependentsOf(e.id()).isEmpty())
                    .sorted(Comparator.comparing((ResourceEntry e) -> e.lastAccessedAt))
                    .limit(Math.max(0, limit))
                    .map(ResourceEntry::id)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }

        int disposed = 0;
        for (String id : candidates) {
            try {
                disposeWithDependents(id);
                disposed++;
            } catch (ResourceNotFoundException e) {
                LOG.debug("Idle resource {} already gone", id);
            } catch (RuntimeException e) {
                LOG.warn("Idle eviction of {} failed: {}", id, e.getMessage());
            }
        }
        lastEvictionTime = now;
        if (!candidates.isEmpty()) {
            LOG.info("Evicted {} of {} idle resource(s) (idle window {})", disposed, candidates.size(), idleWindow);
        }
        return disposed;
    }

    // ---------------------------------------------------------------- queries

    @Override
    public Optional<ResourceManageable> get(String id) {
        return readLocked(() -> Optional.ofNullable(entries.get(id)).map(e -> e.resource));
    }

    @Override
    public Optional<ResourceInfo> describe(String id) {
        return snapshots(e -> e.id().equals(id)).stream().findFirst().map(EntrySnapshot::toInfo);
    }

    @Override
    public boolean contains(String id) {
        return readLocked(() -> entries.containsKey(id));
    }

    @Override
    public List<ResourceInfo> listAll() {
        return snapshots(e -> true).stream().map(EntrySnapshot::toInfo).toList();
    }

    @Override
    public List<ResourceInfo> listByKind(ResourceKind kind) {
        return snapshots(e -> e.resource.kind() == kind).stream().map(EntrySnapshot::toInfo).toList();
    }

    @Override
    public List<ResourceInfo> listByState(ResourceState state) {
        return snapshots(e -> e.state == state).stream().map(EntrySnapshot::toInfo).toList();
    }

    @Override
    public Set<String> dependenciesOf(String id) {
        return readLocked(() -> Collections.unmodifiableSet(new LinkedHashSet<>(graph.dependenciesOf(id))));
    }

    @Override
    public Set<String> dependentsOf(String id) {
        return readLocked(() -> Collections.unmodifiableSet(new LinkedHashSet<>(graph.dependentsOf(id))));
    }

    @Override
    public ResourceRegistryStatistics statistics() {
        List<ResourceInfo> infos = listAll();
        Map<ResourceKind, Integer> byKind = new EnumMap<>(ResourceKind.class);
        Map<ResourceState, Integer> byState = new EnumMap<>(ResourceState.class);
        long memory = 0L;
        for (ResourceInfo info : infos) {
            byKind.merge(info.kind(), 1, Integer::sum);
            byState.merge(info.state(), 1, Integer::sum);
            memory += info.estimatedMemoryBytes();
        }
        return new ResourceRegistryStatistics(infos.size(), memory, byKind, byState, lastEvictionTime);
    }

    @Override
    public Map<String, Object> exportState() {
        List<ResourceInfo> infos = listAll();
        ResourceRegistryStatistics stats = statistics();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("registry.totalResources", stats.totalResources());
        state.put("registry.estimatedMemoryBytes", stats.estimatedMemoryBytes());
        if (stats.lastEvictionTime() != null) {
            state.put("registry.lastEvictionTime", stats.lastEvictionTime().toString());
        }
        stats.stateDistribution().forEach((s, count) -> state.put("registry.state." + s.name(), count));
        state.put("registry.resourceIds", String.join(",", infos.stream().map(ResourceInfo::id).toList()));
        for (ResourceInfo info : infos) {
            state.put("registry.resource." + info.id() + ".kind", info.kind().name());
            state.put("registry.resource." + info.id() + ".state", info.state().name());
        }
        return state;
    }

    /**
     * Adds a dependency edge without the cycle check, to simulate corrupted dependency data.
     */
    void addDependencyEdgeUnchecked(String from, String to) {
        lock.writeLock().lock();
        try {
            graph.addEdgeUnchecked(from, to);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- internals

    // Caller holds the write lock
    private ResourceEntry requireEntry(String id) {
        ResourceEntry entry = entries.get(id);
        if (entry == null) {
            throw new ResourceNotFoundException(id);
        }
        return entry;
    }

    private <T> T readLocked(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<EntrySnapshot> snapshots(Predicate<ResourceEntry> filter) {
        return readLocked(() -> entries.values().stream()
                .filter(filter)
                .map(e -> new EntrySnapshot(e.resource, e.state, e.createdAt, e.lastAccessedAt))
                .toList());
    }

    private void publishStateChange(ResourceEntry entry, ResourceState from, ResourceState to) {
        try {
            publisher.publishEvent(new ResourceStateChangedEvent(entry.id(), entry.resource.kind(), from, to,
                    clock.instant()));
        } catch (RuntimeException e) {
            LOG.warn("State change listener failed for {} ({} -> {}): {}", entry.id(), from, to, e.getMessage());
        }
    }

    /**
     * State captured under the read lock; {@code describeSelf()} is called after the lock is released.
     */
    private record EntrySnapshot(ResourceManageable resource, ResourceState state,
                                 Instant createdAt, Instant lastAccessedAt) {
        ResourceInfo toInfo() {
            ResourceInfo self;
            try {
                self = resource.describeSelf();
            } catch (RuntimeException e) {
                LOG.debug("describeSelf failed for {}: {}", resource.id(), e.getMessage());
                self = null;
            }
            if (self == null) {
                self = ResourceInfo.of(resource.id(), resource.kind(), resource.id());
            }
            return self.withRegistryView(state, createdAt, lastAccessedAt);
        }
    }
}
