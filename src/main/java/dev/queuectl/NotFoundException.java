package dev.queuectl;

public class NotFoundException extends QueueException {
    private final String jobId;

    public NotFoundException(String jobId) {
        super("Job '" + jobId + "' not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
