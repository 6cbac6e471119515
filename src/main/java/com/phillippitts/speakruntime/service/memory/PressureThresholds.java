package com.phillippitts.speakruntime.service.memory;

import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.domain.PressureLevel;

/**
 * Ascending usage-ratio thresholds. A ratio maps to the highest level whose threshold it
 * reaches, so classification is monotonic in the ratio.
 *
 * @param warning ratio at which pressure becomes WARNING
 * @param critical ratio at which pressure becomes CRITICAL
 * @param emergency ratio at which pressure becomes EMERGENCY
 */
public record PressureThresholds(double warning, double critical, double emergency) {

    public PressureThresholds {
        if (!(0.0 <= warning && warning <= critical && critical <= emergency && emergency <= 1.0)) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds must satisfy 0 <= warning <= critical <= emergency <= 1 (got %.2f, %.2f, %.2f)",
                    warning, critical, emergency));
        }
    }

    public static PressureThresholds defaults() {
        return new PressureThresholds(0.60, 0.90, 0.95);
    }

    public static PressureThresholds from(MemoryMonitorProperties properties) {
        return new PressureThresholds(properties.getWarningThreshold(),
                properties.getCriticalThreshold(), properties.getEmergencyThreshold());
    }

    public PressureLevel classify(double usageRatio) {
        if (usageRatio >= emergency) {
            return PressureLevel.EMERGENCY;
        }
        if (usageRatio >= critical) {
            return PressureLevel.CRITICAL;
        }
        if (usageRatio >= warning) {
            return PressureLevel.WARNING;
        }
        return PressureLevel.NORMAL;
    }
}
