package com.phillippitts.speakruntime.exception;

/**
 * Thrown when a resource's initialization hook (or the initialization of one of its
 * dependencies) fails. The resource is left in the ERROR state.
 */
public class ResourceInitializationException extends ResourceException {

    public ResourceInitializationException(String resourceId, Throwable cause) {
        super(resourceId, "Resource initialization failed: " + resourceId + " - " + describe(cause), cause);
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
