package com.phillippitts.speakruntime.exception;

/**
 * Thrown when a resource is registered under an id that is already in use.
 */
public class ResourceAlreadyRegisteredException extends ResourceException {

    public ResourceAlreadyRegisteredException(String resourceId) {
        super(resourceId, "Resource already registered: " + resourceId);
    }
}
