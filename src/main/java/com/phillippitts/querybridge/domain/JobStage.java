package com.phillippitts.querybridge.domain;

/**
 * Progress milestones reported while a job is processed. Percentages only ever increase.
 */
public enum JobStage {
    QUEUED(0),
    STARTED(20),
    INVOKING_WORKER(40),
    STORING(80),
    COMPLETE(100);

    private final int percent;

    JobStage(int percent) {
        this.percent = percent;
    }

    public int percent() {
        return percent;
    }
}
