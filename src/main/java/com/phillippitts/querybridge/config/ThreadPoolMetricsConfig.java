package com.phillippitts.querybridge.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes job processor pool metrics via Micrometer:
 * <ul>
 *   <li>job.pool.size - Current number of threads in the pool</li>
 *   <li>job.pool.active - Number of threads running a processor loop</li>
 *   <li>job.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("jobExecutor") ObjectProvider<ThreadPoolTaskExecutor> jobExecutorProvider) {
        this.jobExecutorProvider = jobExecutorProvider;
    }

    @Bean
    public MeterBinder jobExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.jobExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("job.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the job pool")
                    .register(registry);

            Gauge.builder("job.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running a job processor loop")
                    .register(registry);

            Gauge.builder("job.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the job executor")
                    .register(registry);

            LOG.info("Job thread pool metrics registered: job.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.jobExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Job Thread Pool Health: size={}/{}, active={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount());
    }
}
