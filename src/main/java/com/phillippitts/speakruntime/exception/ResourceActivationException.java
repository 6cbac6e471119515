package com.phillippitts.speakruntime.exception;

/**
 * Thrown when a resource's activate or deactivate hook fails.
 */
public class ResourceActivationException extends ResourceException {

    private final String operation;

    public ResourceActivationException(String resourceId, String operation, Throwable cause) {
        super(resourceId, "Resource " + operation + " failed: " + resourceId + " - "
                + ResourceInitializationException.describe(cause), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
