package com.phillippitts.querybridge.service.queue;

/**
 * Coarse queue health derived from job counts.
 */
public enum QueueHealth {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    static final int MAX_FAILED = 10;
    static final int MAX_WAITING = 50;
    static final int MAX_ACTIVE = 10;

    static QueueHealth of(long waiting, long active, long failed) {
        if (failed > MAX_FAILED) {
            return UNHEALTHY;
        }
        if (waiting > MAX_WAITING || active > MAX_ACTIVE) {
            return DEGRADED;
        }
        return HEALTHY;
    }
}
