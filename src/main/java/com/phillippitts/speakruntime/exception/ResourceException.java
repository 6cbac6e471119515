package com.phillippitts.speakruntime.exception;

/**
 * Base type for failures reported by the resource registry.
 *
 * <p>Every subtype names the resource the failing operation was invoked for, so callers
 * (the lifecycle coordinator or external consumers) can log and react per resource.
 */
public abstract class ResourceException extends SpeakRuntimeException {

    private final String resourceId;

    protected ResourceException(String resourceId, String message) {
        super(message);
        this.resourceId = resourceId;
    }

    protected ResourceException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
