package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.domain.PressureLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs one cleanup pass: release caches, reclaim idle resources, delete transient files,
 * then run the JVM's reclamation primitive.
 *
 * <p>Every step runs even if an earlier one throws; failures are logged and reported in the
 * {@link CleanupResult}. Callbacks run in registration order.
 */
public class MemoryCleanupService {

    private static final Logger LOG = LogManager.getLogger(MemoryCleanupService.class);

    static final String STEP_RECLAIM_RESOURCES = "reclaim-idle-resources";
    static final String STEP_TEMP_FILES = "temp-files";
    static final String STEP_RUNTIME_RECLAIM = "runtime-reclaim";

    private final Map<String, MemoryCleanupCallback> callbacks = new ConcurrentHashMap<>();
    private final List<String> callbackOrder = new CopyOnWriteArrayList<>();
    private final TemporaryFileCleaner tempFileCleaner;
    private final Runnable runtimeReclaim;
    private volatile ResourceReclaimer resourceReclaimer;

    /**
     * @param tempFileCleaner transient file step, may be null to skip it
     * @param runtimeReclaim reclamation primitive (usually {@code System::gc}), may be null to skip it
     */
    public MemoryCleanupService(TemporaryFileCleaner tempFileCleaner, Runnable runtimeReclaim) {
        this.tempFileCleaner = tempFileCleaner;
        this.runtimeReclaim = runtimeReclaim;
    }

    public void setResourceReclaimer(ResourceReclaimer resourceReclaimer) {
        this.resourceReclaimer = resourceReclaimer;
    }

    /**
     * Registers a cache callback. A second registration under the same name replaces the first.
     */
    public void registerCallback(String name, MemoryCleanupCallback callback) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(callback, "callback");
        if (callbacks.put(name, callback) != null) {
            LOG.warn("Replacing memory cleanup callback '{}'", name);
        } else {
            callbackOrder.add(name);
        }
    }

    public void unregisterCallback(String name) {
        if (callbacks.remove(name) != null) {
            callbackOrder.remove(name);
        }
    }

    public int callbackCount() {
        return callbacks.size();
    }

    /**
     * Runs every step once.
     */
    public CleanupResult runCleanup(PressureLevel level) {
        List<String> failed = new ArrayList<>();

        int callbacksRun = 0;
        for (String name : callbackOrder) {
            MemoryCleanupCallback callback = callbacks.get(name);
            if (callback == null) {
                continue;
            }
            try {
                callback.releaseCaches(level);
                callbacksRun++;
            } catch (RuntimeException e) {
                LOG.warn("Memory cleanup callback '{}' failed: {}", name, e.getMessage());
                failed.add("callback:" + name);
            }
        }

        int reclaimed = 0;
        ResourceReclaimer reclaimer = resourceReclaimer;
        if (reclaimer != null) {
            try {
                reclaimed = reclaimer.reclaimIdleResources();
            } catch (RuntimeException e) {
                LOG.warn("Idle resource reclamation failed: {}", e.getMessage());
                failed.add(STEP_RECLAIM_RESOURCES);
            }
        }

        int filesDeleted = 0;
        if (tempFileCleaner != null) {
            try {
                filesDeleted = tempFileCleaner.clean();
            } catch (Exception e) {
                LOG.warn("Temp file cleanup failed: {}", e.getMessage());
                failed.add(STEP_TEMP_FILES);
            }
        }

        if (runtimeReclaim != null) {
            try {
                runtimeReclaim.run();
            } catch (RuntimeException e) {
                LOG.warn("Runtime memory reclamation failed: {}", e.getMessage());
                failed.add(STEP_RUNTIME_RECLAIM);
            }
        }

        CleanupResult result = new CleanupResult(callbacksRun, reclaimed, filesDeleted, failed);
        LOG.debug("Cleanup pass finished: {}", result);
        return result;
    }
}
