package com.phillippitts.querybridge.service.queue;

/**
 * Outcome of a retention sweep.
 *
 * @param completedRemoved completed jobs removed
 * @param failedRemoved failed jobs removed
 */
public record CleanResult(int completedRemoved, int failedRemoved) {
}
