package com.phillippitts.speakruntime.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the memory monitor, its cleanup pipeline and the leak detector.
 *
 * <p>Example application.properties:
 * <pre>
 * runtime.memory.sample-interval=5s
 * runtime.memory.warning-threshold=0.60
 * runtime.memory.cleanup-cooldown=30s
 * runtime.memory.leak.threshold=5m
 * runtime.memory.cleanup.temp-directory=${java.io.tmpdir}/speak-runtime
 * </pre>
 */
@ConfigurationProperties(prefix = "runtime.memory")
@Validated
public class MemoryMonitorProperties {

    /** Which memory pool the sampler measures. */
    public enum Source { HEAP, SYSTEM }

    /** Enable/disable periodic sampling. */
    private boolean enabled = true;

    @NotNull
    private Source source = Source.HEAP;

    @NotNull
    private Duration sampleInterval = Duration.ofSeconds(5);

    /** Number of samples retained for trend analysis. */
    @Positive(message = "History limit must be positive")
    private int historyLimit = 100;

    /** Usage ratio at which pressure becomes WARNING. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double warningThreshold = 0.60;

    /** Usage ratio at which pressure becomes CRITICAL. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double criticalThreshold = 0.90;

    /** Usage ratio at which pressure becomes EMERGENCY. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double emergencyThreshold = 0.95;

    /** Minimum time between two soft (WARNING-level) cleanups. */
    @NotNull
    private Duration cleanupCooldown = Duration.ofSeconds(30);

    /** Relative growth of app memory between two samples reported as a spike. */
    @DecimalMin("0.0")
    private double spikeRatio = 0.20;

    /** Extra cleanup passes run after the first one at EMERGENCY. */
    @Min(0)
    private int emergencyExtraPasses = 3;

    @NotNull
    private Duration emergencyPassPause = Duration.ofMillis(100);

    @Valid
    private Leak leak = new Leak();

    @Valid
    private Cleanup cleanup = new Cleanup();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Duration getSampleInterval() {
        return sampleInterval;
    }

    public void setSampleInterval(Duration sampleInterval) {
        this.sampleInterval = sampleInterval;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public double getWarningThreshold() {
        return warningThreshold;
    }

    public void setWarningThreshold(double warningThreshold) {
        this.warningThreshold = warningThreshold;
    }

    public double getCriticalThreshold() {
        return criticalThreshold;
    }

    public void setCriticalThreshold(double criticalThreshold) {
        this.criticalThreshold = criticalThreshold;
    }

    public double getEmergencyThreshold() {
        return emergencyThreshold;
    }

    public void setEmergencyThreshold(double emergencyThreshold) {
        this.emergencyThreshold = emergencyThreshold;
    }

    public Duration getCleanupCooldown() {
        return cleanupCooldown;
    }

    public void setCleanupCooldown(Duration cleanupCooldown) {
        this.cleanupCooldown = cleanupCooldown;
    }

    public double getSpikeRatio() {
        return spikeRatio;
    }

    public void setSpikeRatio(double spikeRatio) {
        this.spikeRatio = spikeRatio;
    }

    public int getEmergencyExtraPasses() {
        return emergencyExtraPasses;
    }

    public void setEmergencyExtraPasses(int emergencyExtraPasses) {
        this.emergencyExtraPasses = emergencyExtraPasses;
    }

    public Duration getEmergencyPassPause() {
        return emergencyPassPause;
    }

    public void setEmergencyPassPause(Duration emergencyPassPause) {
        this.emergencyPassPause = emergencyPassPause;
    }

    public Leak getLeak() {
        return leak;
    }

    public void setLeak(Leak leak) {
        this.leak = leak;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    /**
     * Leak detector configuration.
     */
    public static class Leak {
        private boolean enabled = true;

        /** Age after which a still-tracked allocation is reported. */
        @NotNull
        private Duration threshold = Duration.ofMinutes(5);

        @Positive(message = "Max tracked allocations must be positive")
        private int maxTracked = 1000;

        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(60);

        /** Record a short stack excerpt as origin when the caller supplies none. */
        private boolean captureStackTraces = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getThreshold() {
            return threshold;
        }

        public void setThreshold(Duration threshold) {
            this.threshold = threshold;
        }

        public int getMaxTracked() {
            return maxTracked;
        }

        public void setMaxTracked(int maxTracked) {
            this.maxTracked = maxTracked;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public boolean isCaptureStackTraces() {
            return captureStackTraces;
        }

        public void setCaptureStackTraces(boolean captureStackTraces) {
            this.captureStackTraces = captureStackTraces;
        }
    }

    /**
     * Cleanup pipeline configuration.
     */
    public static class Cleanup {
        /** Directory scanned for transient files. Only files matching the patterns are removed. */
        private String tempDirectory = System.getProperty("java.io.tmpdir") + "/speak-runtime";

        private List<String> tempFilePrefixes = new ArrayList<>(List.of("tmp_"));

        private List<String> tempFileSuffixes = new ArrayList<>(List.of(".tmp", ".temp"));

        /** Invoke the JVM's collector at the end of each cleanup. */
        private boolean reclaimEnabled = true;

        public String getTempDirectory() {
            return tempDirectory;
        }

        public void setTempDirectory(String tempDirectory) {
            this.tempDirectory = tempDirectory;
        }

        public List<String> getTempFilePrefixes() {
            return tempFilePrefixes;
        }

        public void setTempFilePrefixes(List<String> tempFilePrefixes) {
            this.tempFilePrefixes = tempFilePrefixes;
        }

        public List<String> getTempFileSuffixes() {
            return tempFileSuffixes;
        }

        public void setTempFileSuffixes(List<String> tempFileSuffixes) {
            this.tempFileSuffixes = tempFileSuffixes;
        }

        public boolean isReclaimEnabled() {
            return reclaimEnabled;
        }

        public void setReclaimEnabled(boolean reclaimEnabled) {
            this.reclaimEnabled = reclaimEnabled;
        }
    }
}
