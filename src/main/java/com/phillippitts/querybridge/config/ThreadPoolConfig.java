package com.phillippitts.querybridge.config;

import com.phillippitts.querybridge.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool hosting the job queue's processor loops.
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
     * Creates the job processor pool.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.job.*} properties:
     * <ul>
     *   <li>Core pool: default 3 - one thread per processor loop</li>
     *   <li>Max pool: default 16 - room for replacements spawned after stalls</li>
     *   <li>Queue: default 0 - a processor either gets a thread or is rejected</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Processor loops never
     * finish on their own, so running one on the caller thread would hijack it; the queue
     * logs the rejection instead.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the pool thread so startup context reaches processor logs.
     *
     * @return Configured executor for job processors
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor() {
        ThreadPoolProperties.JobPoolProperties jobProps = threadPoolProperties.getJob();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(jobProps.getCorePoolSize());
        executor.setMaxPoolSize(jobProps.getMaxPoolSize());
        executor.setQueueCapacity(jobProps.getQueueCapacity());
        executor.setThreadNamePrefix(jobProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(jobProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
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
