package com.phillippitts.querybridge.service.queue;

/**
 * Snapshot of job counts by state.
 *
 * @param waiting jobs waiting for a processor
 * @param active jobs being processed, including ones just declared stalled
 * @param completed retained completed jobs
 * @param failed retained failed jobs
 * @param delayed stalled jobs waiting out their requeue backoff
 * @param paused whether processing is paused
 * @param total sum of the above counts
 * @param health health derived from the counts
 */
public record QueueStats(
        long waiting,
        long active,
        long completed,
        long failed,
        long delayed,
        boolean paused,
        long total,
        QueueHealth health
) {
}
