package com.phillippitts.querybridge.domain;

/**
 * Lifecycle states of a queued job.
 *
 * <pre>
 * WAITING -> ACTIVE -> COMPLETED | FAILED
 * ACTIVE -> STALLED -> DELAYED -> WAITING   (bounded by the stall budget)
 * </pre>
 */
public enum JobState {
    WAITING,
    ACTIVE,
    STALLED,
    DELAYED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
