package com.phillippitts.speakruntime.domain;

/**
 * Category of a managed resource. Used by the lifecycle coordinator to decide which
 * resources are critical (kept running) and which can be paused or released.
 */
public enum ResourceKind {
    /** Audio engines, recorders and capture lines. */
    AUDIO,
    /** Speech recognition engines and their models. */
    RECOGNITION,
    /** File handles and temporary files. */
    FILE,
    /** Network connections and sessions. */
    NETWORK,
    /** Timers and schedulers. */
    TIMER,
    /** Event observers and listeners. */
    OBSERVER,
    /** In-memory caches. */
    MEMORY,
    /** Presentation components. */
    UI,
    /** Operating system facilities. */
    SYSTEM
}
