package com.phillippitts.speakruntime.service.memory;

/**
 * Disposes idle resources on behalf of the memory monitor.
 *
 * <p>Implemented by the lifecycle coordinator so the monitor never depends on the registry.
 */
@FunctionalInterface
public interface ResourceReclaimer {

    /**
     * @return number of resources released
     */
    int reclaimIdleResources();
}
