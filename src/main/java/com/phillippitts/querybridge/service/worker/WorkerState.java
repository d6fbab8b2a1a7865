package com.phillippitts.querybridge.service.worker;

/**
 * State of the current worker process as seen by the bridge.
 *
 * <pre>
 * STARTING -> READY -> (PROCESSING -> READY)* -> CRASHED -> STARTING
 * any -> STOPPED after the bridge is closed
 * </pre>
 */
public enum WorkerState {
    STARTING,
    READY,
    PROCESSING,
    CRASHED,
    STOPPED
}
