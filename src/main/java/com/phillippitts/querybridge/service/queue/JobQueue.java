package com.phillippitts.querybridge.service.queue;

import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.JobSnapshot;
import com.phillippitts.querybridge.domain.QueryResult;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Asynchronous job queue in front of the worker bridge and the response cache.
 *
 * @see ExecutorJobQueue
 */
public interface JobQueue {

    /**
     * Registers a job and returns immediately.
     *
     * @param query query text
     * @param callerId caller id; null or blank means {@code anonymous}
     * @param sessionId session id; null or blank means {@code session-<epochMillis>}
     * @param context prior turns; null means none
     * @return handle for awaiting the result
     * @throws com.phillippitts.querybridge.exception.QueryValidationException on invalid input
     */
    JobHandle submit(String query, String callerId, String sessionId, List<ContextTurn> context);

    /**
     * Waits for a job's result. Timing out does not cancel the job.
     *
     * @throws com.phillippitts.querybridge.exception.QueueTimeoutException if no result within {@code timeout}
     * @throws com.phillippitts.querybridge.exception.QueryBridgeException the job's terminal failure
     */
    QueryResult await(JobHandle handle, Duration timeout);

    Optional<JobSnapshot> status(String jobId);

    QueueStats stats();

    /**
     * Removes completed jobs finished more than {@code grace} ago and failed jobs finished
     * more than 24 x {@code grace} ago.
     */
    CleanResult clean(Duration grace);

    void pause();

    void resume();

    boolean isPaused();
}
