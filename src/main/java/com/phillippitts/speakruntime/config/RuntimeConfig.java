package com.phillippitts.speakruntime.config;

import com.phillippitts.speakruntime.config.properties.LifecycleProperties;
import com.phillippitts.speakruntime.config.properties.MemoryMonitorProperties;
import com.phillippitts.speakruntime.config.properties.ResourceRegistryProperties;
import com.phillippitts.speakruntime.service.lifecycle.DefaultLifecycleCoordinator;
import com.phillippitts.speakruntime.service.lifecycle.JsonFileSnapshotStore;
import com.phillippitts.speakruntime.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.speakruntime.service.lifecycle.LifecycleSignalBridge;
import com.phillippitts.speakruntime.service.lifecycle.SnapshotStore;
import com.phillippitts.speakruntime.service.memory.DefaultMemoryMonitor;
import com.phillippitts.speakruntime.service.memory.JvmMemorySampler;
import com.phillippitts.speakruntime.service.memory.LeakDetector;
import com.phillippitts.speakruntime.service.memory.MemoryCleanupCallback;
import com.phillippitts.speakruntime.service.memory.MemoryCleanupService;
import com.phillippitts.speakruntime.service.memory.MemoryMonitor;
import com.phillippitts.speakruntime.service.memory.MemorySampler;
import com.phillippitts.speakruntime.service.memory.TemporaryFileCleaner;
import com.phillippitts.speakruntime.service.resource.DefaultResourceRegistry;
import com.phillippitts.speakruntime.service.resource.ResourceRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Wires the registry, memory monitor and lifecycle coordinator explicitly.
 * Uses constructor injection for the properties and publisher shared across bean methods.
 */
@Configuration
public class RuntimeConfig {

    private static final Logger LOG = LogManager.getLogger(RuntimeConfig.class);

    private final ResourceRegistryProperties registryProperties;
    private final MemoryMonitorProperties memoryProperties;
    private final LifecycleProperties lifecycleProperties;
    private final ApplicationEventPublisher publisher;

    public RuntimeConfig(ResourceRegistryProperties registryProperties,
                         MemoryMonitorProperties memoryProperties,
                         LifecycleProperties lifecycleProperties,
                         ApplicationEventPublisher publisher) {
        this.registryProperties = registryProperties;
        this.memoryProperties = memoryProperties;
        this.lifecycleProperties = lifecycleProperties;
        this.publisher = publisher;
    }

    /**
     * Time source for timestamps, idle windows and cooldowns.
     */
    @Bean
    public Clock runtimeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceRegistry resourceRegistry(@Qualifier("lifecycleExecutor") Executor executor, Clock clock) {
        return new DefaultResourceRegistry(registryProperties, executor, publisher, clock);
    }

    @Bean
    public MemorySampler memorySampler() {
        return new JvmMemorySampler(memoryProperties.getSource());
    }

    /**
     * Cleanup service. Callback beans register under their bean names, in {@code @Order} order.
     */
    @Bean
    public MemoryCleanupService memoryCleanupService(ListableBeanFactory beanFactory) {
        MemoryMonitorProperties.Cleanup cleanup = memoryProperties.getCleanup();
        TemporaryFileCleaner tempFiles = new TemporaryFileCleaner(
                Path.of(cleanup.getTempDirectory()), cleanup.getTempFilePrefixes(), cleanup.getTempFileSuffixes());
        Runnable runtimeReclaim = cleanup.isReclaimEnabled() ? System::gc : null;

        MemoryCleanupService service = new MemoryCleanupService(tempFiles, runtimeReclaim);
        beanFactory.getBeansOfType(MemoryCleanupCallback.class).entrySet().stream()
                .sorted(Map.Entry.comparingByValue(AnnotationAwareOrderComparator.INSTANCE))
                .forEach(entry -> service.registerCallback(entry.getKey(), entry.getValue()));
        return service;
    }

    @Bean
    public LeakDetector leakDetector(Clock clock) {
        return new LeakDetector(memoryProperties.getLeak(), publisher, clock);
    }

    /**
     * Memory monitor. Periodic sampling starts with the context and stops before the scheduler
     * is shut down.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public MemoryMonitor memoryMonitor(MemorySampler sampler,
                                       MemoryCleanupService cleanupService,
                                       LeakDetector leakDetector,
                                       @Qualifier("lifecycleExecutor") Executor executor,
                                       @Qualifier("runtimeScheduler") TaskScheduler scheduler,
                                       Clock clock) {
        return new DefaultMemoryMonitor(memoryProperties, sampler, cleanupService, leakDetector,
                publisher, executor, scheduler, clock);
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new JsonFileSnapshotStore(Path.of(lifecycleProperties.getSnapshotPath()));
    }

    /**
     * Lifecycle coordinator. Also installed as the memory monitor's idle-resource reclaimer.
     */
    @Bean
    public LifecycleCoordinator lifecycleCoordinator(ResourceRegistry registry,
                                                     MemoryMonitor memoryMonitor,
                                                     SnapshotStore snapshotStore,
                                                     @Qualifier("lifecycleExecutor") Executor executor,
                                                     Clock clock) {
        DefaultLifecycleCoordinator coordinator = new DefaultLifecycleCoordinator(registry, memoryMonitor,
                snapshotStore, lifecycleProperties, registryProperties, publisher, executor, clock);
        memoryMonitor.setResourceReclaimer(coordinator);
        LOG.info("Lifecycle coordinator ready (critical kinds: {})", lifecycleProperties.getCriticalKinds());
        return coordinator;
    }

    @Bean
    public LifecycleSignalBridge lifecycleSignalBridge(LifecycleCoordinator coordinator) {
        return new LifecycleSignalBridge(coordinator, lifecycleProperties);
    }
}
