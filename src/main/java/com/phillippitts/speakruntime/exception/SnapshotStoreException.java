package com.phillippitts.speakruntime.exception;

/**
 * Thrown when the runtime snapshot cannot be written to or read from the external store.
 */
public class SnapshotStoreException extends SpeakRuntimeException {

    private final String location;

    public SnapshotStoreException(String location, String message, Throwable cause) {
        super(message + " (location: " + location + ")", cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
