package com.phillippitts.speakruntime.exception;

/**
 * Base exception for all speak-runtime specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakRuntimeException extends RuntimeException {

    public SpeakRuntimeException(String message) {
        super(message);
    }

    public SpeakRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakRuntimeException(Throwable cause) {
        super(cause);
    }
}
