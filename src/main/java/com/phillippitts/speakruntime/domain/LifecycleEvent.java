package com.phillippitts.speakruntime.domain;

import java.util.Optional;

/**
 * External application or OS signal understood by the lifecycle coordinator.
 *
 * <p>Each event optionally names the phase it moves the application into. {@link #LOW_MEMORY}
 * notifies services and requests cleanup without changing phase.
 */
public enum LifecycleEvent {
    LAUNCHED(LifecyclePhase.ACTIVE),
    WILL_FOREGROUND(LifecyclePhase.ACTIVE),
    DID_BACKGROUND(LifecyclePhase.BACKGROUND),
    WILL_TERMINATE(LifecyclePhase.TERMINATING),
    LOW_MEMORY(null),
    SLEEP(LifecyclePhase.SLEEPING),
    WAKE(LifecyclePhase.ACTIVE);

    private final LifecyclePhase targetPhase;

    LifecycleEvent(LifecyclePhase targetPhase) {
        this.targetPhase = targetPhase;
    }

    public Optional<LifecyclePhase> targetPhase() {
        return Optional.ofNullable(targetPhase);
    }
}
