package com.phillippitts.speakruntime.config.properties;

import com.phillippitts.speakruntime.domain.ResourceKind;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Typed properties for the lifecycle coordinator.
 */
@Validated
@ConfigurationProperties(prefix = "runtime.lifecycle")
public class LifecycleProperties {

    private static final List<ResourceKind> DEFAULT_CRITICAL_KINDS =
            List.of(ResourceKind.AUDIO, ResourceKind.RECOGNITION, ResourceKind.SYSTEM);

    /**
     * Kinds kept running in the background and restored on foreground/wake. Every other
     * kind is treated as non-critical.
     */
    @NotNull
    private final Set<ResourceKind> criticalKinds;

    /** Kinds whose non-active resources are disposed when the system goes to sleep. */
    @NotNull
    private final Set<ResourceKind> sleepReleaseKinds;

    @NotNull
    private final Duration transitionSoftTimeout;

    /** How long context shutdown waits for the terminate transition before moving on. */
    @NotNull
    private final Duration shutdownWait;

    /** File the runtime snapshot is written to. */
    @NotNull
    private final String snapshotPath;

    @ConstructorBinding
    public LifecycleProperties(List<ResourceKind> criticalKinds,
                               List<ResourceKind> sleepReleaseKinds,
                               Duration transitionSoftTimeout,
                               Duration shutdownWait,
                               String snapshotPath) {
        this.criticalKinds = toSet(criticalKinds == null ? DEFAULT_CRITICAL_KINDS : criticalKinds);
        this.sleepReleaseKinds = toSet(sleepReleaseKinds == null ? List.of() : sleepReleaseKinds);
        this.transitionSoftTimeout = transitionSoftTimeout == null ? Duration.ofSeconds(30) : transitionSoftTimeout;
        this.shutdownWait = shutdownWait == null ? Duration.ofSeconds(30) : shutdownWait;
        this.snapshotPath = snapshotPath == null
                ? System.getProperty("user.home") + "/.speak-runtime/runtime-state.json"
                : snapshotPath;
    }

    /**
     * Defaults for tests and programmatic construction.
     */
    public LifecycleProperties() {
        this(null, null, null, null, null);
    }

    private static Set<ResourceKind> toSet(List<ResourceKind> kinds) {
        return kinds.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(kinds));
    }

    public Set<ResourceKind> getCriticalKinds() {
        return criticalKinds;
    }

    public boolean isCritical(ResourceKind kind) {
        return criticalKinds.contains(kind);
    }

    public Set<ResourceKind> getSleepReleaseKinds() {
        return sleepReleaseKinds;
    }

    public Duration getTransitionSoftTimeout() {
        return transitionSoftTimeout;
    }

    public Duration getShutdownWait() {
        return shutdownWait;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }
}
