package dev.queuectl;

import dev.queuectl.Models.JobState;

public class StateException extends QueueException {
    private final String jobId;
    private final JobState actual;

    public StateException(String jobId, JobState expected, JobState actual) {
        super("Job '" + jobId + "' is " + (actual == null ? "unknown" : actual.dbValue()) + ", expected " + expected.dbValue());
        this.jobId = jobId;
        this.actual = actual;
    }

    public StateException(String jobId, String message) {
        super("Job '" + jobId + "': " + message);
        this.jobId = jobId;
        this.actual = null;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getActual() {
        return actual;
    }
}
