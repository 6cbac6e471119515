package com.phillippitts.speakruntime.service.memory;

import java.util.List;

/**
 * Outcome of one cleanup pass.
 *
 * @param callbacksRun cache callbacks that completed
 * @param resourcesReclaimed idle resources released through the reclaimer
 * @param tempFilesDeleted transient files removed
 * @param failedSteps names of steps (or callbacks) that threw
 */
public record CleanupResult(int callbacksRun, int resourcesReclaimed, int tempFilesDeleted, List<String> failedSteps) {

    public CleanupResult {
        failedSteps = failedSteps == null ? List.of() : List.copyOf(failedSteps);
    }

    public boolean hasFailures() {
        return !failedSteps.isEmpty();
    }
}
