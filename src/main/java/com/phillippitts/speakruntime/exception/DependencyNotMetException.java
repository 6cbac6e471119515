package com.phillippitts.speakruntime.exception;

import java.util.List;

/**
 * Thrown when a resource declares dependencies that have not been registered yet.
 * Dependencies must always be registered before their dependents.
 */
public class DependencyNotMetException extends ResourceException {

    private final List<String> missingDependencies;

    public DependencyNotMetException(String resourceId, List<String> missingDependencies) {
        super(resourceId, "Dependencies not met for " + resourceId + ", missing: "
                + String.join(", ", missingDependencies));
        this.missingDependencies = List.copyOf(missingDependencies);
    }

    public List<String> getMissingDependencies() {
        return missingDependencies;
    }
}
