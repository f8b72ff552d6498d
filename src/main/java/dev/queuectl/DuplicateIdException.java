package dev.queuectl;

public class DuplicateIdException extends QueueException {
    private final String jobId;

    public DuplicateIdException(String jobId) {
        super("Job with id '" + jobId + "' already exists");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
