package com.phillippitts.speakruntime.domain;

/**
 * Coarse-grained application run state. Exactly one phase is current at any time and
 * {@link #TERMINATING} is absorbing.
 */
public enum LifecyclePhase {
    LAUNCHING,
    ACTIVE,
    BACKGROUND,
    SLEEPING,
    TERMINATING,
    ERROR
}
