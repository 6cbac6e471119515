package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.domain.PressureLevel;

/**
 * Releases caches owned by a collaborator when the monitor runs a cleanup.
 */
@FunctionalInterface
public interface MemoryCleanupCallback {

    /**
     * @param level pressure level when the cleanup started
     */
    void releaseCaches(PressureLevel level);
}
