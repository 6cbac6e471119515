package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.config.properties.LifecycleProperties;
import com.phillippitts.speakruntime.config.properties.ResourceRegistryProperties;
import com.phillippitts.speakruntime.domain.LifecycleEvent;
import com.phillippitts.speakruntime.domain.LifecyclePhase;
import com.phillippitts.speakruntime.domain.ResourceInfo;
import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;
import com.phillippitts.speakruntime.service.lifecycle.event.LifecyclePhaseChangedEvent;
import com.phillippitts.speakruntime.service.memory.MemoryMonitor;
import com.phillippitts.speakruntime.service.memory.ResourceReclaimer;
import com.phillippitts.speakruntime.service.resource.ResourceRegistry;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Default {@link LifecycleCoordinator}.
 *
 * <p>Events are chained on a single future so they run one at a time, in order, on the
 * lifecycle executor. For each event the registered services are notified first, then the
 * phase transition (if any) runs its steps. Each step, and each resource operation inside a
 * step, is isolated: a failure is logged and counted and the next one still runs.
 *
 * <p>Also acts as the memory monitor's {@link ResourceReclaimer}, evicting idle resources from
 * the registry.
 */
public class DefaultLifecycleCoordinator implements LifecycleCoordinator, ResourceReclaimer {

    private static final Logger LOG = LogManager.getLogger(DefaultLifecycleCoordinator.class);

    static final String MDC_EVENT = "lifecycleEvent";
    static final String MDC_PHASE = "lifecyclePhase";

    private final ResourceRegistry registry;
    private final MemoryMonitor memoryMonitor;
    private final SnapshotStore snapshotStore;
    private final LifecycleProperties properties;
    private final ResourceRegistryProperties registryProperties;
    private final ApplicationEventPublisher publisher;
    private final Executor executor;
    private final Clock clock;
    private final Instant createdAt;

    private final LifecyclePhaseMachine phaseMachine = new LifecyclePhaseMachine();
    private final Map<String, ServiceLifecycle> services = new LinkedHashMap<>();

    private final Object queueLock = new Object();
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

    private volatile boolean transitioning;
    private volatile Instant lastEventTime;
    private volatile RuntimeSnapshot lastRestoredSnapshot;
    private final AtomicLong eventsHandled = new AtomicLong();
    private final AtomicLong failedSteps = new AtomicLong();
    private final AtomicLong failedCallbacks = new AtomicLong();

    public DefaultLifecycleCoordinator(ResourceRegistry registry,
                                       MemoryMonitor memoryMonitor,
                                       SnapshotStore snapshotStore,
                                       LifecycleProperties properties,
                                       ResourceRegistryProperties registryProperties,
                                       ApplicationEventPublisher publisher,
                                       Executor executor,
                                       Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.memoryMonitor = Objects.requireNonNull(memoryMonitor, "memoryMonitor");
        this.snapshotStore = Objects.requireNonNull(snapshotStore, "snapshotStore");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.registryProperties = Objects.requireNonNull(registryProperties, "registryProperties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
    }

    // ---------------------------------------------------------------- events

    @Override
    public CompletableFuture<LifecyclePhase> trigger(LifecycleEvent event) {
        Objects.requireNonNull(event, "event");
        synchronized (queueLock) {
            CompletableFuture<LifecyclePhase> next = tail
                    .handle((r, e) -> null)
                    .thenComposeAsync(v -> handle(event), executor);
            tail = next;
            return next;
        }
    }

    /**
     * Runs the synchronous part of an event on the calling worker and returns a future for the
     * rest. Registry initialization and disposal are chained, never joined, so the worker is
     * released while resource hooks run on the same executor.
     */
    private CompletableFuture<LifecyclePhase> handle(LifecycleEvent event) {
        LifecyclePhase from = phaseMachine.current();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put(MDC_EVENT, event.name())
                .put(MDC_PHASE, from.name())) {
            lastEventTime = clock.instant();
            eventsHandled.incrementAndGet();
            if (from == LifecyclePhase.TERMINATING) {
                LOG.debug("Ignoring {}: runtime is terminating", event);
                return CompletableFuture.completedFuture(from);
            }
            LOG.info("Handling lifecycle event {} in phase {}", event, from);

            notifyServices(event);

            if (event == LifecycleEvent.LOW_MEMORY) {
                step("request soft cleanup", () -> memoryMonitor.requestCleanup("low memory signal", false));
                return CompletableFuture.completedFuture(phaseMachine.current());
            }

            LifecyclePhase target = event.targetPhase().orElseThrow();
            if (from == target) {
                LOG.debug("Already in phase {}, nothing to do for {}", target, event);
                return CompletableFuture.completedFuture(from);
            }
            if (!phaseMachine.moveTo(target)) {
                LOG.warn("Unexpected lifecycle transition {} -> {} on {}, ignored", from, target, event);
                return CompletableFuture.completedFuture(from);
            }
            publishPhaseChange(from, target, event);
            return runTransition(from, target)
                    .handle((v, error) -> {
                        if (error != null) {
                            failEvent(event, Futures.unwrap(error));
                        }
                        return phaseMachine.current();
                    });
        } catch (RuntimeException e) {
            failEvent(event, e);
            return CompletableFuture.completedFuture(phaseMachine.current());
        }
    }

    private void failEvent(LifecycleEvent event, Throwable error) {
        LOG.error("Lifecycle event {} failed: {}", event, error.getMessage(), error);
        enterError(event);
    }

    private CompletableFuture<Void> runTransition(LifecyclePhase from, LifecyclePhase to) {
        long startNanos = System.nanoTime();
        long failuresBefore = failedSteps.get();
        transitioning = true;
        CompletableFuture<Void> steps;
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MDC_PHASE, to.name())) {
            LOG.info("Lifecycle transition {} -> {}", from, to);
            steps = transitionSteps(from, to);
        } catch (RuntimeException e) {
            steps = CompletableFuture.failedFuture(e);
        }
        SoftTimeouts.watch(steps, properties.getTransitionSoftTimeout(), "Lifecycle transition " + from + " -> " + to);
        return steps.whenComplete((v, error) -> {
            transitioning = false;
            LOG.info("Lifecycle transition {} -> {} finished in {} ms ({} failure(s))",
                    from, to, TimeUtils.elapsedMillis(startNanos), failedSteps.get() - failuresBefore);
        });
    }

    private CompletableFuture<Void> transitionSteps(LifecyclePhase from, LifecyclePhase to) {
        if (to == LifecyclePhase.TERMINATING) {
            step("persist final snapshot", this::persistSnapshot);
            return asyncStep("dispose all resources", this::disposeAll)
                    .thenRun(() -> step("unregister services", this::unregisterAllServices));
        }
        if (from == LifecyclePhase.LAUNCHING && to == LifecyclePhase.ACTIVE) {
            return asyncStep("initialize resources", this::initializeUninitialized)
                    .thenRun(() -> step("validate critical kinds", this::warnAboutMissingCriticalKinds));
        }
        if (from == LifecyclePhase.ACTIVE && to == LifecyclePhase.BACKGROUND) {
            step("deactivate non-critical resources",
                    () -> deactivateWhere(info -> !properties.isCritical(info.kind())));
            step("request soft cleanup",
                    () -> memoryMonitor.requestCleanup("application moved to background", false));
            step("persist snapshot", this::persistSnapshot);
        } else if (from == LifecyclePhase.BACKGROUND && to == LifecyclePhase.ACTIVE) {
            step("activate critical resources", this::activateCritical);
            step("reload snapshot", this::reloadSnapshot);
        } else if (from == LifecyclePhase.ACTIVE && to == LifecyclePhase.SLEEPING) {
            step("deactivate active resources", () -> deactivateWhere(info -> true));
            return asyncStep("release sleep resources", this::releaseSleepKinds);
        } else if (from == LifecyclePhase.SLEEPING && to == LifecyclePhase.ACTIVE) {
            step("check critical kinds", this::warnAboutCriticalKindsWithoutInstances);
            step("activate critical resources", this::activateCritical);
        }
        return CompletableFuture.completedFuture(null);
    }

    private void enterError(LifecycleEvent cause) {
        LifecyclePhase from = phaseMachine.current();
        if (phaseMachine.moveTo(LifecyclePhase.ERROR)) {
            publishPhaseChange(from, LifecyclePhase.ERROR, cause);
        }
    }

    // ---------------------------------------------------------------- transition steps

    private void step(String name, Runnable action) {
        try {
            LOG.debug("Lifecycle step: {}", name);
            action.run();
        } catch (RuntimeException e) {
            failedSteps.incrementAndGet();
            LOG.warn("Lifecycle step '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    private CompletableFuture<Void> asyncStep(String name, Supplier<CompletableFuture<Void>> action) {
        LOG.debug("Lifecycle step: {}", name);
        return Futures.invokeHook(action).handle((v, error) -> {
            if (error != null) {
                failedSteps.incrementAndGet();
                Throwable cause = Futures.unwrap(error);
                LOG.warn("Lifecycle step '{}' failed: {}", name, cause.getMessage(), cause);
            }
            return null;
        });
    }

    private void forEachResource(String operation, List<ResourceInfo> targets, Consumer<String> action) {
        for (ResourceInfo info : targets) {
            try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("resourceId", info.id())) {
                action.accept(info.id());
            } catch (RuntimeException e) {
                failedSteps.incrementAndGet();
                Throwable cause = Futures.unwrap(e);
                LOG.warn("Could not {} resource {}: {}", operation, info.id(), cause.getMessage());
            }
        }
    }

    /**
     * Runs {@code action} for each target one after another, each on completion of the previous
     * one. A failed resource is logged and counted and the chain moves on.
     */
    private CompletableFuture<Void> chainEachResource(String operation, List<ResourceInfo> targets,
                                                      Function<String, CompletableFuture<Void>> action) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ResourceInfo info : targets) {
            String id = info.id();
            chain = chain.thenCompose(v -> {
                CompletableFuture<Void> started;
                try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("resourceId", id)) {
                    started = Futures.invokeHook(() -> action.apply(id));
                }
                return started.handle((r, error) -> {
                    if (error != null) {
                        failedSteps.incrementAndGet();
                        LOG.warn("Could not {} resource {}: {}", operation, id, Futures.unwrap(error).getMessage());
                    }
                    return null;
                });
            });
        }
        return chain;
    }

    private CompletableFuture<Void> initializeUninitialized() {
        return chainEachResource("initialize", registry.listByState(ResourceState.UNINITIALIZED), id -> {
            // A dependent may already have initialized this one
            ResourceState state = registry.describe(id).map(ResourceInfo::state).orElse(null);
            return state == ResourceState.UNINITIALIZED
                    ? registry.initialize(id)
                    : CompletableFuture.completedFuture(null);
        });
    }

    private void warnAboutMissingCriticalKinds() {
        for (ResourceKind kind : missingCriticalKinds()) {
            LOG.warn("No READY or ACTIVE resource of critical kind {}", kind);
        }
    }

    private void warnAboutCriticalKindsWithoutInstances() {
        for (ResourceKind kind : properties.getCriticalKinds()) {
            if (registry.listByKind(kind).isEmpty()) {
                LOG.warn("No resource of critical kind {} is registered, it must be re-created", kind);
            }
        }
    }

    private void deactivateWhere(Predicate<ResourceInfo> filter) {
        List<ResourceInfo> targets = registry.listByState(ResourceState.ACTIVE).stream().filter(filter).toList();
        forEachResource("deactivate", targets, registry::deactivate);
    }

    private void activateCritical() {
        List<ResourceInfo> targets = registry.listByState(ResourceState.READY).stream()
                .filter(info -> properties.isCritical(info.kind()))
                .toList();
        forEachResource("activate", targets, registry::activate);
    }

    private CompletableFuture<Void> releaseSleepKinds() {
        List<ResourceInfo> targets = registry.listAll().stream()
                .filter(info -> properties.getSleepReleaseKinds().contains(info.kind()))
                .filter(info -> info.state() != ResourceState.ACTIVE)
                .toList();
        return chainEachResource("release", targets, this::disposeIfPresent);
    }

    private CompletableFuture<Void> disposeAll() {
        return chainEachResource("dispose", registry.listAll(), this::disposeIfPresent);
    }

    // Disposing a dependency earlier in the chain also removes its dependents
    private CompletableFuture<Void> disposeIfPresent(String id) {
        return registry.contains(id) ? registry.dispose(id) : CompletableFuture.completedFuture(null);
    }

    private void persistSnapshot() {
        RuntimeSnapshot snapshot = captureSnapshot();
        snapshotStore.save(snapshot.toMap());
        LOG.info("Runtime snapshot persisted ({} entries)", snapshot.entries().size());
    }

    private void reloadSnapshot() {
        Optional<RuntimeSnapshot> loaded = snapshotStore.load().map(RuntimeSnapshot::fromMap);
        if (loaded.isEmpty()) {
            LOG.debug("No runtime snapshot to reload");
            return;
        }
        lastRestoredSnapshot = loaded.get();
        LOG.info("Reloaded runtime snapshot captured at {} in phase {} ({} resources then)",
                lastRestoredSnapshot.capturedAt(), lastRestoredSnapshot.phase(),
                lastRestoredSnapshot.longEntry("registry.totalResources", 0L));
    }

    RuntimeSnapshot captureSnapshot() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.putAll(registry.exportState());
        entries.putAll(memoryMonitor.exportState());
        entries.putAll(exportState());
        return new RuntimeSnapshot(RuntimeSnapshot.CURRENT_SCHEMA_VERSION, clock.instant(),
                phaseMachine.current(), entries);
    }

    // ---------------------------------------------------------------- services

    private void notifyServices(LifecycleEvent event) {
        for (Map.Entry<String, ServiceLifecycle> entry : servicesSnapshot().entrySet()) {
            notifyService(entry.getKey(), entry.getValue(), event);
        }
    }

    private void notifyService(String id, ServiceLifecycle service, LifecycleEvent event) {
        try {
            switch (event) {
                case LAUNCHED -> service.onLaunched();
                case WILL_FOREGROUND -> service.onWillForeground();
                case DID_BACKGROUND -> service.onDidBackground();
                case WILL_TERMINATE -> service.onWillTerminate();
                case LOW_MEMORY -> service.onLowMemory();
                case SLEEP -> service.onSleep();
                case WAKE -> service.onWake();
            }
            LOG.debug("Service {} handled {}", id, event);
        } catch (RuntimeException e) {
            failedCallbacks.incrementAndGet();
            LOG.warn("Service {} failed to handle {}: {}", id, event, e.getMessage(), e);
        }
    }

    private Map<String, ServiceLifecycle> servicesSnapshot() {
        synchronized (services) {
            return new LinkedHashMap<>(services);
        }
    }

    private void unregisterAllServices() {
        int count;
        synchronized (services) {
            count = services.size();
            services.clear();
        }
        LOG.info("Unregistered {} lifecycle service(s)", count);
    }

    @Override
    public void registerService(String id, ServiceLifecycle service) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(service, "service");
        LifecyclePhase phase = phaseMachine.current();
        if (phase == LifecyclePhase.TERMINATING) {
            LOG.warn("Refusing to register service {}: runtime is terminating", id);
            return;
        }
        boolean replaced;
        synchronized (services) {
            replaced = services.put(id, service) != null;
        }
        if (replaced) {
            LOG.warn("Service {} was already registered and has been replaced", id);
        }
        LOG.info("Registered lifecycle service {}", id);
        if (phase != LifecyclePhase.LAUNCHING) {
            notifyService(id, service, LifecycleEvent.LAUNCHED);
        }
    }

    @Override
    public boolean unregisterService(String id) {
        boolean removed;
        synchronized (services) {
            removed = services.remove(id) != null;
        }
        if (removed) {
            LOG.info("Unregistered lifecycle service {}", id);
        } else {
            LOG.warn("Tried to unregister unknown lifecycle service {}", id);
        }
        return removed;
    }

    @Override
    public List<String> registeredServiceIds() {
        List<String> ids = new ArrayList<>(servicesSnapshot().keySet());
        ids.sort(null);
        return ids;
    }

    @Override
    public boolean isServiceRegistered(String id) {
        synchronized (services) {
            return services.containsKey(id);
        }
    }

    // ---------------------------------------------------------------- reclaimer

    @Override
    public int reclaimIdleResources() {
        if (phaseMachine.current() == LifecyclePhase.TERMINATING) {
            return 0;
        }
        return registry.evictIdle(registryProperties.getIdleEvictionWindow(),
                registryProperties.getMaxEvictionsPerCleanup());
    }

    // ---------------------------------------------------------------- queries

    @Override
    public LifecyclePhase currentPhase() {
        return phaseMachine.current();
    }

    @Override
    public boolean isTransitioning() {
        return transitioning;
    }

    @Override
    public List<ResourceKind> missingCriticalKinds() {
        List<ResourceKind> missing = new ArrayList<>();
        for (ResourceKind kind : ResourceKind.values()) {
            if (!properties.isCritical(kind)) {
                continue;
            }
            boolean operational = registry.listByKind(kind).stream().anyMatch(info -> info.state().isOperational());
            if (!operational) {
                missing.add(kind);
            }
        }
        return missing;
    }

    @Override
    public LifecycleStatistics statistics() {
        int serviceCount;
        synchronized (services) {
            serviceCount = services.size();
        }
        return new LifecycleStatistics(phaseMachine.current(), transitioning, lastEventTime, serviceCount,
                eventsHandled.get(), failedSteps.get(), failedCallbacks.get(),
                Duration.between(createdAt, clock.instant()));
    }

    @Override
    public Map<String, Object> exportState() {
        LifecycleStatistics stats = statistics();
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("lifecycle.currentPhase", stats.currentPhase().name());
        state.put("lifecycle.transitioning", stats.transitioning());
        if (stats.lastEventTime() != null) {
            state.put("lifecycle.lastEventTime", stats.lastEventTime().toString());
        }
        state.put("lifecycle.registeredServicesCount", stats.registeredServices());
        state.put("lifecycle.registeredServices", String.join(",", registeredServiceIds()));
        state.put("lifecycle.failedSteps", stats.failedSteps());
        return state;
    }

    @Override
    public Optional<RuntimeSnapshot> lastRestoredSnapshot() {
        return Optional.ofNullable(lastRestoredSnapshot);
    }

    private void publishPhaseChange(LifecyclePhase from, LifecyclePhase to, LifecycleEvent cause) {
        LOG.info("Lifecycle phase {} -> {} ({})", from, to, cause);
        try {
            publisher.publishEvent(new LifecyclePhaseChangedEvent(from, to, cause, clock.instant()));
        } catch (RuntimeException e) {
            LOG.warn("Phase change listener failed ({} -> {}): {}", from, to, e.getMessage());
        }
    }
}
