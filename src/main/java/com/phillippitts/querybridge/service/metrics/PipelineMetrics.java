package com.phillippitts.querybridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the request pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Worker call latency and success/failure by reason</li>
 *   <li>Worker process restarts by reason</li>
 *   <li>Response cache hits and misses</li>
 *   <li>Job completions and failures by error kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "querybridge";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records end-to-end bridge latency, retries included.
     *
     * @param durationNanos duration in nanoseconds
     * @param outcome {@code success} or {@code failure}
     */
    public void recordWorkerLatency(long durationNanos, String outcome) {
        Timer.builder(METRIC_PREFIX + ".worker.latency")
                .description("Time taken by the worker bridge to answer a query")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementWorkerSuccess() {
        Counter.builder(METRIC_PREFIX + ".worker.success")
                .description("Number of successful worker calls")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (timeout, execution, crashed, validation)
     */
    public void incrementWorkerFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".worker.failure")
                .description("Number of failed worker calls")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the previous process went away (crash, timeout, startup-timeout, ...)
     */
    public void incrementWorkerRestart(String reason) {
        Counter.builder(METRIC_PREFIX + ".worker.restarts")
                .description("Number of worker process restarts")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementCacheHit() {
        Counter.builder(METRIC_PREFIX + ".cache.hits")
                .description("Number of response cache hits")
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss() {
        Counter.builder(METRIC_PREFIX + ".cache.misses")
                .description("Number of response cache misses")
                .register(registry)
                .increment();
    }

    public void incrementJobCompleted(boolean cached) {
        Counter.builder(METRIC_PREFIX + ".jobs.completed")
                .description("Number of completed jobs")
                .tag("cached", String.valueOf(cached))
                .register(registry)
                .increment();
    }

    /**
     * @param kind error kind name of the terminal failure
     */
    public void incrementJobFailed(String kind) {
        Counter.builder(METRIC_PREFIX + ".jobs.failed")
                .description("Number of failed jobs")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void incrementJobStalled() {
        Counter.builder(METRIC_PREFIX + ".jobs.stalled")
                .description("Number of times a job was detected as stalled")
                .register(registry)
                .increment();
    }
}
