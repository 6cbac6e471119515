package com.phillippitts.speakruntime.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the lifecycle executor (resource hooks, cleanup and phase
 * transitions) and the runtime scheduler (memory sampling and leak sweeps).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private LifecyclePoolProperties lifecycle = new LifecyclePoolProperties();
    private SchedulerPoolProperties scheduler = new SchedulerPoolProperties();

    public LifecyclePoolProperties getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(LifecyclePoolProperties lifecycle) {
        this.lifecycle = lifecycle;
    }

    public SchedulerPoolProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerPoolProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Lifecycle executor pool configuration.
     */
    public static class LifecyclePoolProperties {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 50;
        private int keepAliveSeconds = 60;
        private int awaitTerminationSeconds = 30;
        private String threadNamePrefix = "lifecycle-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Runtime scheduler pool configuration.
     */
    public static class SchedulerPoolProperties {
        private int poolSize = 2;
        private String threadNamePrefix = "runtime-timer-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
