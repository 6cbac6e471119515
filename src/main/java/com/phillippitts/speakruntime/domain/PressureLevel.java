package com.phillippitts.speakruntime.domain;

/**
 * Discretized memory pressure, ordered from least to most severe.
 */
public enum PressureLevel {
    NORMAL,
    WARNING,
    CRITICAL,
    EMERGENCY;

    public boolean isAtLeast(PressureLevel other) {
        return compareTo(other) >= 0;
    }
}
