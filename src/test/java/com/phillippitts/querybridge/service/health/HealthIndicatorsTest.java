package com.phillippitts.querybridge.service.health;

import com.phillippitts.querybridge.service.cache.CacheStats;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import com.phillippitts.querybridge.service.queue.JobQueue;
import com.phillippitts.querybridge.service.queue.QueueHealth;
import com.phillippitts.querybridge.service.queue.QueueStats;
import com.phillippitts.querybridge.service.worker.WorkerBridge;
import com.phillippitts.querybridge.service.worker.WorkerState;
import com.phillippitts.querybridge.service.worker.WorkerStats;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HealthIndicatorsTest {

    private static WorkerStats workerStats(WorkerState state) {
        return new WorkerStats(10, 9, 1, 50, 90.0, 11, 1, 1, false, state, 0);
    }

    @Test
    void workerUpWhenReady() {
        WorkerBridge bridge = mock(WorkerBridge.class);
        when(bridge.stats()).thenReturn(workerStats(WorkerState.READY));

        Health health = new WorkerHealthIndicator(bridge, false, 1000).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("state", "READY").containsEntry("restarts", 1L);
        verify(bridge, never()).healthCheck(any());
    }

    @Test
    void workerDegradedWhileStartingAndDownWhenCrashed() {
        WorkerBridge bridge = mock(WorkerBridge.class);
        WorkerHealthIndicator indicator = new WorkerHealthIndicator(bridge, false, 1000);

        when(bridge.stats()).thenReturn(workerStats(WorkerState.STARTING));
        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));

        when(bridge.stats()).thenReturn(workerStats(WorkerState.CRASHED));
        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void failedProbeMarksWorkerDown() {
        WorkerBridge bridge = mock(WorkerBridge.class);
        when(bridge.stats()).thenReturn(workerStats(WorkerState.READY));
        when(bridge.healthCheck(Duration.ofMillis(1000))).thenReturn(false);

        Health health = new WorkerHealthIndicator(bridge, true, 1000).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("probe", "failed");
    }

    @Test
    void cacheDegradedWhenProbeFails() {
        ResponseCache cache = mock(ResponseCache.class);
        when(cache.stats()).thenReturn(new CacheStats(1, 1, 1, 0, 3, 50.0, 2, 1, true, true));
        when(cache.healthCheck()).thenReturn(false);

        Health health = new ResponseCacheHealthIndicator(cache).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("errors", 3L).containsEntry("primaryInUse", true);
    }

    @Test
    void cacheUpWhenProbeSucceeds() {
        ResponseCache cache = mock(ResponseCache.class);
        when(cache.stats()).thenReturn(new CacheStats(0, 0, 0, 0, 0, 0.0, 0, 0, true, false));
        when(cache.healthCheck()).thenReturn(true);

        assertThat(new ResponseCacheHealthIndicator(cache).health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void queueStatusFollowsQueueHealth() {
        JobQueue queue = mock(JobQueue.class);
        JobQueueHealthIndicator indicator = new JobQueueHealthIndicator(queue);

        when(queue.stats()).thenReturn(new QueueStats(0, 1, 5, 0, 0, false, 6, QueueHealth.HEALTHY));
        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

        when(queue.stats()).thenReturn(new QueueStats(60, 3, 5, 0, 0, false, 68, QueueHealth.DEGRADED));
        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));

        when(queue.stats()).thenReturn(new QueueStats(0, 0, 5, 11, 0, false, 16, QueueHealth.UNHEALTHY));
        Health health = indicator.health();
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("failed", 11L);
    }
}
