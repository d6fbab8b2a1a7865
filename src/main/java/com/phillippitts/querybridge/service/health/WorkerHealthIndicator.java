package com.phillippitts.querybridge.service.health;

import com.phillippitts.querybridge.service.worker.WorkerBridge;
import com.phillippitts.querybridge.service.worker.WorkerState;
import com.phillippitts.querybridge.service.worker.WorkerStats;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Health indicator for the worker process.
 *
 * <ul>
 *   <li>UP: process ready or processing</li>
 *   <li>DEGRADED: process starting</li>
 *   <li>DOWN: crashed and waiting for restart, or bridge stopped</li>
 * </ul>
 *
 * <p>With {@code health.worker.probe-enabled=true} a synthetic query is also run; it goes
 * through the same FIFO as real traffic, so it is off by default.
 */
@Component("workerHealthIndicator")
public class WorkerHealthIndicator implements HealthIndicator {

    private final WorkerBridge bridge;
    private final boolean probeEnabled;
    private final Duration probeTimeout;

    public WorkerHealthIndicator(WorkerBridge bridge,
                                 @Value("${health.worker.probe-enabled:false}") boolean probeEnabled,
                                 @Value("${health.worker.probe-timeout-ms:35000}") long probeTimeoutMs) {
        this.bridge = bridge;
        this.probeEnabled = probeEnabled;
        this.probeTimeout = Duration.ofMillis(probeTimeoutMs);
    }

    @Override
    public Health health() {
        WorkerStats stats = bridge.stats();
        WorkerState state = stats.state();

        Health.Builder builder = switch (state) {
            case READY, PROCESSING -> Health.up();
            case STARTING -> Health.status("DEGRADED");
            case CRASHED, STOPPED -> Health.down();
        };

        if (probeEnabled) {
            boolean probeOk = bridge.healthCheck(probeTimeout);
            builder.withDetail("probe", probeOk ? "ok" : "failed");
            if (!probeOk) {
                builder.down();
            }
        }

        return builder
                .withDetail("state", state.name())
                .withDetail("restarts", stats.restarts())
                .withDetail("restartsInWindow", stats.restartsInWindow())
                .withDetail("coolingDown", stats.coolingDown())
                .withDetail("pendingRequests", stats.pendingRequests())
                .withDetail("successRate", String.format("%.2f%%", stats.successRate()))
                .build();
    }
}
