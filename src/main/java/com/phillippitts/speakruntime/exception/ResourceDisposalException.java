package com.phillippitts.speakruntime.exception;

/**
 * Thrown when a resource's disposal hook fails. The resource is left in the ERROR state
 * and stays registered so it remains visible for diagnostics.
 */
public class ResourceDisposalException extends ResourceException {

    public ResourceDisposalException(String resourceId, Throwable cause) {
        super(resourceId, "Resource disposal failed: " + resourceId + " - "
                + ResourceInitializationException.describe(cause), cause);
    }
}
