package com.phillippitts.speakruntime.service.lifecycle;

/**
 * Callbacks for collaborators that react to application and OS lifecycle signals.
 *
 * <p>All methods default to no-ops. Callbacks run sequentially on the coordinator's thread;
 * an exception from one service is logged and does not prevent the others from running.
 */
public interface ServiceLifecycle {

    default void onLaunched() {
    }

    default void onWillForeground() {
    }

    default void onDidBackground() {
    }

    default void onWillTerminate() {
    }

    default void onLowMemory() {
    }

    default void onSleep() {
    }

    default void onWake() {
    }
}
