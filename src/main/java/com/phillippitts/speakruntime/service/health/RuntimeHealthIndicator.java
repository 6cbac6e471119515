package com.phillippitts.speakruntime.service.health;

import com.phillippitts.speakruntime.domain.LifecyclePhase;
import com.phillippitts.speakruntime.domain.MemoryStatistics;
import com.phillippitts.speakruntime.domain.PressureLevel;
import com.phillippitts.speakruntime.domain.ResourceKind;
import com.phillippitts.speakruntime.domain.ResourceState;
import com.phillippitts.speakruntime.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.speakruntime.service.memory.MemoryMonitor;
import com.phillippitts.speakruntime.service.resource.ResourceRegistry;
import com.phillippitts.speakruntime.service.resource.ResourceRegistryStatistics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Health indicator for the resource runtime.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: runtime operational, no failed resources, pressure below CRITICAL</li>
 *   <li>DEGRADED: resources in ERROR, a critical kind has no usable resource, or CRITICAL pressure</li>
 *   <li>DOWN: lifecycle in ERROR or TERMINATING, or EMERGENCY pressure</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RuntimeHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ResourceRegistry registry;
    private final MemoryMonitor memoryMonitor;
    private final LifecycleCoordinator coordinator;

    public RuntimeHealthIndicator(ResourceRegistry registry,
                                  MemoryMonitor memoryMonitor,
                                  LifecycleCoordinator coordinator) {
        this.registry = registry;
        this.memoryMonitor = memoryMonitor;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        LifecyclePhase phase = coordinator.currentPhase();
        PressureLevel pressure = memoryMonitor.currentLevel();
        ResourceRegistryStatistics stats = registry.statistics();
        long failedResources = stats.countIn(ResourceState.ERROR);
        // Critical kinds only matter once launch has initialized resources
        List<ResourceKind> missingCritical = phase == LifecyclePhase.LAUNCHING
                ? List.of()
                : coordinator.missingCriticalKinds();

        Health.Builder builder = new Health.Builder();
        if (phase == LifecyclePhase.ERROR || phase == LifecyclePhase.TERMINATING
                || pressure == PressureLevel.EMERGENCY) {
            builder.down().withDetail("status", "Runtime unavailable");
        } else if (failedResources > 0 || !missingCritical.isEmpty() || pressure == PressureLevel.CRITICAL) {
            builder.status(DEGRADED).withDetail("status", "Runtime running with problems");
        } else {
            builder.up().withDetail("status", "Runtime operational");
        }

        MemoryStatistics memory = memoryMonitor.currentStatistics();
        return builder
                .withDetail("phase", phase.name())
                .withDetail("pressure", pressure.name())
                .withDetail("memoryUsage", formatRatio(memory.usageRatio()))
                .withDetail("resources", stats.totalResources())
                .withDetail("failedResources", failedResources)
                .withDetail("missingCriticalKinds", missingCritical.stream().map(Enum::name).toList())
                .build();
    }

    private static String formatRatio(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
    }
}
