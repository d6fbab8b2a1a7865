package com.phillippitts.querybridge.exception;

/**
 * Thrown when a job id is unknown, or the job was already garbage-collected.
 */
public class JobNotFoundException extends QueryBridgeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(ErrorKind.JOB_NOT_FOUND, "Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
