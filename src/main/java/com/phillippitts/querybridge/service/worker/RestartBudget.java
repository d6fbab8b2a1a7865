package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.config.properties.WorkerProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Sliding-window restart budget for the worker process.
 *
 * <p>Every restart is recorded. While the number of restarts inside the window stays within
 * {@code worker.watchdog.max-restarts-per-window} the normal restart delay applies; beyond
 * that the delay becomes the cooldown, so a crash-looping worker is respawned slowly
 * instead of in a tight loop. The bridge is never disabled outright.
 */
final class RestartBudget {

    private static final Logger LOG = LogManager.getLogger(RestartBudget.class);

    private final long restartDelayMs;
    private final WorkerProperties.Watchdog props;
    private final Clock clock;
    private final Deque<Instant> window = new ArrayDeque<>();
    private Instant coolingDownUntil;

    RestartBudget(long restartDelayMs, WorkerProperties.Watchdog props, Clock clock) {
        this.restartDelayMs = restartDelayMs;
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records a restart and returns how long to wait before performing it.
     *
     * @return delay in milliseconds
     */
    synchronized long nextDelayMs() {
        Instant now = clock.instant();
        pruneOld(now);
        window.addLast(now);
        if (window.size() > props.getMaxRestartsPerWindow()) {
            long cooldownMs = Duration.ofSeconds(props.getCooldownSeconds()).toMillis();
            coolingDownUntil = now.plusMillis(cooldownMs);
            LOG.error("Worker restarted {} times within {}m; delaying next restart by {}s",
                    window.size(), props.getWindowMinutes(), props.getCooldownSeconds());
            return cooldownMs;
        }
        return restartDelayMs;
    }

    synchronized int restartsInWindow() {
        pruneOld(clock.instant());
        return window.size();
    }

    synchronized boolean isCoolingDown() {
        return coolingDownUntil != null && clock.instant().isBefore(coolingDownUntil);
    }

    synchronized void reset() {
        window.clear();
        coolingDownUntil = null;
    }

    private void pruneOld(Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(props.getWindowMinutes()));
        while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
            window.removeFirst();
        }
    }
}
