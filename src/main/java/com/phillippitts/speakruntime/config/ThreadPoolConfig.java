package com.phillippitts.speakruntime.config;

import com.phillippitts.speakruntime.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the runtime.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for resource hooks, memory cleanup and lifecycle orchestration.
     *
     * <p>Pool sizing configured via {@code threadpool.lifecycle.*}:
     * <ul>
     *   <li>Core pool: default 2</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 50 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the task, providing backpressure instead of failing.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext ({@code resourceId},
     * {@code lifecycleEvent}, {@code lifecyclePhase}) from the submitting thread to the worker.
     *
     * @return configured executor for lifecycle work
     */
    @Bean(name = "lifecycleExecutor")
    public Executor lifecycleExecutor() {
        ThreadPoolProperties.LifecyclePoolProperties props = threadPoolProperties.getLifecycle();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for the memory sampler and the leak sweep.
     *
     * @return configured scheduler, shut down with the context
     */
    @Bean(name = "runtimeScheduler")
    public ThreadPoolTaskScheduler runtimeScheduler() {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker for the task's duration and
     * restores the worker's own context afterwards.
     */
    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
