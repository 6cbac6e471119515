package com.phillippitts.speakruntime.config;

import com.phillippitts.speakruntime.domain.ResourceState;
import com.phillippitts.speakruntime.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.speakruntime.service.lifecycle.LifecycleStatistics;
import com.phillippitts.speakruntime.service.memory.MemoryMonitor;
import com.phillippitts.speakruntime.service.memory.MemoryReport;
import com.phillippitts.speakruntime.service.resource.ResourceRegistry;
import com.phillippitts.speakruntime.service.resource.ResourceRegistryStatistics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Exposes runtime gauges via Micrometer.
 *
 * <ul>
 *   <li>runtime.resources.total - registered resources</li>
 *   <li>runtime.resources.error - resources in ERROR</li>
 *   <li>runtime.resources.memory - sum of resource memory estimates, in bytes</li>
 *   <li>runtime.memory.app - app memory of the last sample, in bytes</li>
 *   <li>runtime.memory.pressure - pressure level ordinal (0 NORMAL .. 3 EMERGENCY)</li>
 *   <li>runtime.memory.cleanups - cleanups performed</li>
 *   <li>runtime.memory.tracked - allocations in the leak table</li>
 * </ul>
 *
 * <p>Also logs a one-line runtime summary every minute.
 */
@Configuration
public class RuntimeMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(RuntimeMetricsConfig.class);

    private final ResourceRegistry registry;
    private final MemoryMonitor memoryMonitor;
    private final LifecycleCoordinator coordinator;

    public RuntimeMetricsConfig(ResourceRegistry registry,
                                MemoryMonitor memoryMonitor,
                                LifecycleCoordinator coordinator) {
        this.registry = registry;
        this.memoryMonitor = memoryMonitor;
        this.coordinator = coordinator;
    }

    @Bean
    public MeterBinder runtimeMetrics() {
        return meterRegistry -> {
            Gauge.builder("runtime.resources.total", registry, r -> r.statistics().totalResources())
                    .description("Registered resources")
                    .register(meterRegistry);

            Gauge.builder("runtime.resources.error", registry, r -> r.statistics().countIn(ResourceState.ERROR))
                    .description("Resources in ERROR state")
                    .register(meterRegistry);

            Gauge.builder("runtime.resources.memory", registry, r -> r.statistics().estimatedMemoryBytes())
                    .description("Sum of resource memory estimates")
                    .baseUnit("bytes")
                    .register(meterRegistry);

            Gauge.builder("runtime.memory.app", memoryMonitor, m -> m.currentStatistics().appMemoryUsage())
                    .description("App memory of the last sample")
                    .baseUnit("bytes")
                    .register(meterRegistry);

            Gauge.builder("runtime.memory.pressure", memoryMonitor, m -> m.currentLevel().ordinal())
                    .description("Memory pressure level ordinal")
                    .register(meterRegistry);

            Gauge.builder("runtime.memory.cleanups", memoryMonitor, m -> m.report().cleanupsPerformed())
                    .description("Memory cleanups performed")
                    .register(meterRegistry);

            Gauge.builder("runtime.memory.tracked", memoryMonitor, m -> m.report().trackedAllocations())
                    .description("Allocations tracked for leak detection")
                    .register(meterRegistry);

            LOG.info("Runtime metrics registered: runtime.* available via /actuator/metrics");
        };
    }

    /**
     * Logs a runtime summary every minute.
     */
    @Scheduled(fixedRate = 60_000)
    public void logRuntimeSummary() {
        ResourceRegistryStatistics resources = registry.statistics();
        MemoryReport memory = memoryMonitor.report();
        LifecycleStatistics lifecycle = coordinator.statistics();

        LOG.info("Runtime: phase={}, resources={} (active={}, error={}), pressure={}, app={} bytes, "
                        + "cleanups={}, tracked={}",
                lifecycle.currentPhase(),
                resources.totalResources(),
                resources.countIn(ResourceState.ACTIVE),
                resources.countIn(ResourceState.ERROR),
                memory.currentLevel(),
                memory.currentStatistics().appMemoryUsage(),
                memory.cleanupsPerformed(),
                memory.trackedAllocations()
        );
    }
}
