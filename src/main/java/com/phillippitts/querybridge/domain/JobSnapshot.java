package com.phillippitts.querybridge.domain;

import com.phillippitts.querybridge.exception.ErrorKind;

import java.time.Instant;

/**
 * Immutable point-in-time view of a job. Safe to hand to any thread or serialize.
 *
 * @param id job id
 * @param callerId caller the job was submitted for
 * @param sessionId caller session
 * @param state lifecycle state at snapshot time
 * @param progress progress percentage (0-100)
 * @param result result when {@code state == COMPLETED}, otherwise null
 * @param failureKind error kind when {@code state == FAILED}, otherwise null
 * @param failureMessage human-readable failure reason when failed, otherwise null
 * @param attempts number of times a processor picked the job up
 * @param stalledCount number of times the job was detected as stalled
 * @param createdAt submission time
 * @param processedAt when a processor last picked the job up, or null
 * @param finishedAt when the job reached a terminal state, or null
 */
public record JobSnapshot(
        String id,
        String callerId,
        String sessionId,
        JobState state,
        int progress,
        QueryResult result,
        ErrorKind failureKind,
        String failureMessage,
        int attempts,
        int stalledCount,
        Instant createdAt,
        Instant processedAt,
        Instant finishedAt
) {
}
