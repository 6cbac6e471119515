package com.phillippitts.speakruntime.exception;

/**
 * Thrown when registering a resource would introduce a cycle into the dependency graph.
 * The graph is left untouched when this is thrown.
 */
public class CircularDependencyException extends ResourceException {

    private final String viaDependency;

    public CircularDependencyException(String resourceId, String viaDependency) {
        super(resourceId, "Circular dependency detected: " + resourceId
                + " is reachable from its dependency " + viaDependency);
        this.viaDependency = viaDependency;
    }

    public String getViaDependency() {
        return viaDependency;
    }
}
