package com.phillippitts.speakruntime.exception;

import com.phillippitts.speakruntime.domain.ResourceState;

/**
 * Thrown when a lifecycle operation is not legal from the resource's current state.
 */
public class InvalidResourceStateException extends ResourceException {

    private final ResourceState actualState;
    private final String operation;

    public InvalidResourceStateException(String resourceId, String operation, ResourceState actualState) {
        super(resourceId, "Cannot " + operation + " resource " + resourceId + " in state " + actualState);
        this.actualState = actualState;
        this.operation = operation;
    }

    public ResourceState getActualState() {
        return actualState;
    }

    public String getOperation() {
        return operation;
    }
}
