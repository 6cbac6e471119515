package com.phillippitts.speakruntime.service.lifecycle;

import com.phillippitts.speakruntime.domain.LifecyclePhase;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Holds the current {@link LifecyclePhase} and the table of legal transitions.
 *
 * <pre>
 * LAUNCHING  → ACTIVE
 * ACTIVE     → BACKGROUND, SLEEPING
 * BACKGROUND → ACTIVE
 * SLEEPING   → ACTIVE
 * any        → TERMINATING, ERROR
 * </pre>
 * TERMINATING is absorbing. Not thread-safe; the coordinator serializes access.
 */
final class LifecyclePhaseMachine {

    private static final Map<LifecyclePhase, Set<LifecyclePhase>> LEGAL = new EnumMap<>(LifecyclePhase.class);

    static {
        LEGAL.put(LifecyclePhase.LAUNCHING, EnumSet.of(LifecyclePhase.ACTIVE));
        LEGAL.put(LifecyclePhase.ACTIVE, EnumSet.of(LifecyclePhase.BACKGROUND, LifecyclePhase.SLEEPING));
        LEGAL.put(LifecyclePhase.BACKGROUND, EnumSet.of(LifecyclePhase.ACTIVE));
        LEGAL.put(LifecyclePhase.SLEEPING, EnumSet.of(LifecyclePhase.ACTIVE));
        LEGAL.put(LifecyclePhase.ERROR, EnumSet.noneOf(LifecyclePhase.class));
        LEGAL.put(LifecyclePhase.TERMINATING, EnumSet.noneOf(LifecyclePhase.class));
    }

    private volatile LifecyclePhase current;

    LifecyclePhaseMachine() {
        this(LifecyclePhase.LAUNCHING);
    }

    LifecyclePhaseMachine(LifecyclePhase initial) {
        this.current = initial;
    }

    LifecyclePhase current() {
        return current;
    }

    static boolean isLegal(LifecyclePhase from, LifecyclePhase to) {
        if (from == LifecyclePhase.TERMINATING) {
            return false;
        }
        if (to == LifecyclePhase.TERMINATING || to == LifecyclePhase.ERROR) {
            return from != to;
        }
        return LEGAL.get(from).contains(to);
    }

    /**
     * Moves to {@code target} if the transition is legal.
     *
     * @return true if the phase changed
     */
    boolean moveTo(LifecyclePhase target) {
        if (!isLegal(current, target)) {
            return false;
        }
        current = target;
        return true;
    }
}
