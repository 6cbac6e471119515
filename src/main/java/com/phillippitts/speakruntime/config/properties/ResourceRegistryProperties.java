package com.phillippitts.speakruntime.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the resource registry.
 */
@ConfigurationProperties(prefix = "runtime.registry")
@Validated
public class ResourceRegistryProperties {

    /** Upper bound on work-list passes for a single dispose call. */
    @Positive(message = "Max disposal passes must be positive")
    private int maxDisposalPasses = 100;

    /** Time after which a running initialize/dispose hook is logged as slow (never cancelled). */
    @NotNull
    private Duration hookSoftTimeout = Duration.ofSeconds(30);

    /** Non-active resources idle longer than this are released during memory cleanup. */
    @NotNull
    private Duration idleEvictionWindow = Duration.ofMinutes(5);

    /** Maximum number of idle resources released by one memory cleanup. */
    @Positive(message = "Max evictions per cleanup must be positive")
    private int maxEvictionsPerCleanup = 50;

    public int getMaxDisposalPasses() {
        return maxDisposalPasses;
    }

    public void setMaxDisposalPasses(int maxDisposalPasses) {
        this.maxDisposalPasses = maxDisposalPasses;
    }

    public Duration getHookSoftTimeout() {
        return hookSoftTimeout;
    }

    public void setHookSoftTimeout(Duration hookSoftTimeout) {
        this.hookSoftTimeout = hookSoftTimeout;
    }

    public Duration getIdleEvictionWindow() {
        return idleEvictionWindow;
    }

    public void setIdleEvictionWindow(Duration idleEvictionWindow) {
        this.idleEvictionWindow = idleEvictionWindow;
    }

    public int getMaxEvictionsPerCleanup() {
        return maxEvictionsPerCleanup;
    }

    public void setMaxEvictionsPerCleanup(int maxEvictionsPerCleanup) {
        this.maxEvictionsPerCleanup = maxEvictionsPerCleanup;
    }
}
