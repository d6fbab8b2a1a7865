package com.phillippitts.querybridge.exception;

import java.util.Map;

/**
 * Thrown when a job's processor was lost more times than the stall budget allows.
 */
public class JobStalledException extends QueryBridgeException {

    public JobStalledException(String jobId, int stalledCount) {
        super(ErrorKind.JOB_STALLED, "Job stalled " + stalledCount + " time(s) and was abandoned",
                Map.of("jobId", jobId, "stalledCount", String.valueOf(stalledCount)), null);
    }
}
