package com.phillippitts.querybridge.util;

import java.time.Duration;

/**
 * Standard timeout values for worker process and thread management.
 *
 * @see com.phillippitts.querybridge.service.worker.WorkerSession
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream reader threads during cleanup (best-effort). Readers are daemon threads.
     */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the dispatcher thread to exit after the bridge is closed.
     */
    public static final Duration DISPATCHER_STOP_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
