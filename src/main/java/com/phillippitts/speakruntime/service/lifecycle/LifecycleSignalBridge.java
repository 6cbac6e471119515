package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.config.properties.LifecycleProperties;
import com.phillippitts.speakruntime.domain.LifecycleEvent;
import com.phillippitts.speakruntime.domain.LifecyclePhase;
import com.phillippitts.speakruntime.domain.PressureLevel;
import com.phillippitts.speakruntime.service.memory.event.PressureLevelChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Feeds application-level signals into the {@link LifecycleCoordinator}.
 *
 * <ul>
 *   <li>{@link ApplicationReadyEvent} becomes {@link LifecycleEvent#LAUNCHED}</li>
 *   <li>{@link ContextClosedEvent} becomes {@link LifecycleEvent#WILL_TERMINATE}; shutdown waits
 *       for teardown up to {@code runtime.lifecycle.shutdown-wait}</li>
 *   <li>memory pressure escalating to CRITICAL or above becomes {@link LifecycleEvent#LOW_MEMORY}</li>
 * </ul>
 */
public class LifecycleSignalBridge {

    private static final Logger LOG = LogManager.getLogger(LifecycleSignalBridge.class);

    private final LifecycleCoordinator coordinator;
    private final Duration shutdownWait;

    public LifecycleSignalBridge(LifecycleCoordinator coordinator, LifecycleProperties properties) {
        this.coordinator = coordinator;
        this.shutdownWait = properties.getShutdownWait();
    }

    @EventListener
    void onApplicationReady(ApplicationReadyEvent event) {
        LOG.info("Application ready, launching runtime");
        coordinator.trigger(LifecycleEvent.LAUNCHED);
    }

    @EventListener
    void onContextClosed(ContextClosedEvent event) {
        if (coordinator.currentPhase() == LifecyclePhase.TERMINATING) {
            return;
        }
        LOG.info("Application context closing, terminating runtime (waiting up to {} ms)", shutdownWait.toMillis());
        try {
            coordinator.trigger(LifecycleEvent.WILL_TERMINATE).get(shutdownWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Runtime teardown still running after {} ms, continuing shutdown", shutdownWait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for runtime teardown");
        } catch (ExecutionException e) {
            LOG.error("Runtime teardown failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    @EventListener
    void onPressureLevelChanged(PressureLevelChangedEvent event) {
        if (event.isEscalation() && event.current().isAtLeast(PressureLevel.CRITICAL)) {
            LOG.debug("Memory pressure escalated to {}, signalling low memory", event.current());
            coordinator.trigger(LifecycleEvent.LOW_MEMORY);
        }
    }
}
