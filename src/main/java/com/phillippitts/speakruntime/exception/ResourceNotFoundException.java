package com.phillippitts.speakruntime.exception;

/**
 * Thrown when an operation names a resource id that is not registered.
 */
public class ResourceNotFoundException extends ResourceException {

    public ResourceNotFoundException(String resourceId) {
        super(resourceId, "Resource not found: " + resourceId);
    }
}
