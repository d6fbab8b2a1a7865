package com.phillippitts.querybridge.service.worker;

/**
 * Snapshot of bridge statistics.
 *
 * @param totalExecutions completed {@code query} calls, successful or not
 * @param successfulExecutions calls that returned an answer
 * @param failedExecutions calls that ended in an exception
 * @param avgElapsedMs mean elapsed time across all completed calls
 * @param successRate percentage of successful calls (0-100)
 * @param workerInvocations request lines written to the worker, counting retries
 * @param restarts worker processes started after the first one
 * @param restartsInWindow restarts inside the current watchdog window
 * @param coolingDown true while restarts are delayed by the cooldown
 * @param state state of the current worker process
 * @param pendingRequests requests waiting for the dispatcher
 */
public record WorkerStats(
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        long avgElapsedMs,
        double successRate,
        long workerInvocations,
        long restarts,
        int restartsInWindow,
        boolean coolingDown,
        WorkerState state,
        int pendingRequests
) {
}
