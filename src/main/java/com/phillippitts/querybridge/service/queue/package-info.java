/**
 * In-process job queue with bounded concurrency, stall detection and retention cleanup.
 *
 * <p>Jobs move through {@code WAITING -> ACTIVE -> COMPLETED | FAILED}, with
 * {@code STALLED -> DELAYED -> WAITING} when a processor stops making progress. Each
 * activation is tagged with a token so results from a superseded attempt are discarded.
 */
package com.phillippitts.querybridge.service.queue;
