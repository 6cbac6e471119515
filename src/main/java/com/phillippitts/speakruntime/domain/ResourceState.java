package com.phillippitts.speakruntime.domain;

/**
 * Per-resource lifecycle state.
 *
 * <pre>
 * UNINITIALIZED → INITIALIZING → READY ⇄ ACTIVE
 *                                  ↓       ↓
 *                               DISPOSING → DISPOSED
 * ERROR is reachable from INITIALIZING, ACTIVE and DISPOSING.
 * </pre>
 *
 * <p>{@link #DISPOSED} and {@link #ERROR} are terminal. A resource in ERROR is only retried
 * by disposing it and registering a new instance.
 */
public enum ResourceState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    ACTIVE,
    DISPOSING,
    DISPOSED,
    ERROR;

    /**
     * @return true for states a resource never leaves on its own
     */
    public boolean isTerminal() {
        return this == DISPOSED || this == ERROR;
    }

    /**
     * @return true when the resource finished initialization and has not started tearing down
     */
    public boolean isOperational() {
        return this == READY || this == ACTIVE;
    }

    /**
     * @return true while a hook is running for the resource
     */
    public boolean isTransient() {
        return this == INITIALIZING || this == DISPOSING;
    }
}
