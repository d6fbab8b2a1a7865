package com.phillippitts.querybridge.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The job pool hosts the queue's processor loops plus replacements spawned for stalled
 * processors, so its max size should exceed {@code queue.concurrency}.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private JobPoolProperties job = new JobPoolProperties();

    public JobPoolProperties getJob() {
        return job;
    }

    public void setJob(JobPoolProperties job) {
        this.job = job;
    }

    /**
     * Job processor pool configuration.
     */
    public static class JobPoolProperties {
        private int corePoolSize = 3;
        private int maxPoolSize = 16;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "job-processor-";

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

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
