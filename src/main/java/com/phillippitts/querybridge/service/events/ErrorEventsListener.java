package com.phillippitts.querybridge.service.events;

import com.phillippitts.querybridge.service.worker.WorkerFailureEvent;
import com.phillippitts.querybridge.service.worker.WorkerReadyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized operator-facing log for worker lifecycle events. Throttled to avoid log spam
 * while a worker is crash-looping.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onWorkerFailure(WorkerFailureEvent e) {
        String key = "worker-failure-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Worker failure: reason={}, message={}, context={}. "
                    + "Check worker.command and the worker's stderr output.", e.reason(), e.message(), e.context());
        }
    }

    @EventListener
    void onWorkerReady(WorkerReadyEvent e) {
        if (e.restart()) {
            LOG.info("Worker recovered: generation={}", e.generation());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
