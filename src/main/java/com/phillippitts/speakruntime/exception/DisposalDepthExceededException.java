package com.phillippitts.speakruntime.exception;

import java.util.List;

/**
 * Thrown when iterative disposal exhausts its pass budget before the work-list drains.
 *
 * <p>This only happens when the dependency data contains a cycle the registration checks
 * should have rejected. The unresolved ids are left registered for manual intervention.
 */
public class DisposalDepthExceededException extends ResourceException {

    private final int maxPasses;
    private final List<String> unresolvedIds;

    public DisposalDepthExceededException(String resourceId, int maxPasses, List<String> unresolvedIds) {
        super(resourceId, "Disposal of " + resourceId + " exceeded " + maxPasses
                + " passes, unresolved: " + String.join(", ", unresolvedIds));
        this.maxPasses = maxPasses;
        this.unresolvedIds = List.copyOf(unresolvedIds);
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public List<String> getUnresolvedIds() {
        return unresolvedIds;
    }
}
