package com.phillippitts.querybridge.service.worker;

import java.time.Instant;

/**
 * Published when a worker process reports readiness.
 *
 * @param at when readiness was observed
 * @param generation session number (1 for the first process)
 * @param restart true when this process replaced a failed one
 */
public record WorkerReadyEvent(Instant at, long generation, boolean restart) {
}
