package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.WorkerAnswer;

import java.time.Duration;
import java.util.List;

/**
 * Mediates request/response exchange with the external worker.
 *
 * <p>Implementations guarantee that the worker never sees more than one request at a time,
 * whatever the number of concurrent callers.
 *
 * @see PersistentWorkerBridge
 */
public interface WorkerBridge {

    /** Caller id used when none is supplied. */
    String DEFAULT_CALLER = "anonymous";

    /**
     * Sends a query to the worker and waits for its answer.
     *
     * <p>Execution failures and timeouts are retried with exponential backoff up to the
     * configured attempt limit. A worker crash fails the call immediately.
     *
     * @param text query text
     * @param callerId caller identifier; null or blank means {@link #DEFAULT_CALLER}
     * @param context prior conversation turns; null means none
     * @return the worker's answer
     * @throws com.phillippitts.querybridge.exception.QueryValidationException on invalid input
     * @throws com.phillippitts.querybridge.exception.WorkerExecutionException when retries are exhausted
     * @throws com.phillippitts.querybridge.exception.WorkerTimeoutException when the last attempt timed out
     * @throws com.phillippitts.querybridge.exception.WorkerCrashedException when the process died mid-request
     */
    WorkerAnswer query(String text, String callerId, List<ContextTurn> context);

    /**
     * Runs a synthetic known-good query.
     *
     * @param timeout upper bound on the probe
     * @return true only if the probe produced an answer in time
     */
    boolean healthCheck(Duration timeout);

    WorkerStats stats();

    void resetStats();

    WorkerState state();
}
