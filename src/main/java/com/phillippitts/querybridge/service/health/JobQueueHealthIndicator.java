package com.phillippitts.querybridge.service.health;

import com.phillippitts.querybridge.service.queue.JobQueue;
import com.phillippitts.querybridge.service.queue.QueueStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the job queue, mapping {@link com.phillippitts.querybridge.service.queue.QueueHealth}
 * onto actuator statuses.
 */
@Component("jobQueueHealthIndicator")
public class JobQueueHealthIndicator implements HealthIndicator {

    private final JobQueue queue;

    public JobQueueHealthIndicator(JobQueue queue) {
        this.queue = queue;
    }

    @Override
    public Health health() {
        QueueStats stats = queue.stats();
        Health.Builder builder = switch (stats.health()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status("DEGRADED");
            case UNHEALTHY -> Health.down();
        };
        return builder
                .withDetail("waiting", stats.waiting())
                .withDetail("active", stats.active())
                .withDetail("failed", stats.failed())
                .withDetail("delayed", stats.delayed())
                .withDetail("paused", stats.paused())
                .build();
    }
}
