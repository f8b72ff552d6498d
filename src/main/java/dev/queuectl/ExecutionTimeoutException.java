package dev.queuectl;

public class ExecutionTimeoutException extends QueueException {
    private final int timeoutSeconds;
    private final double elapsedSeconds;

    public ExecutionTimeoutException(int timeoutSeconds, double elapsedSeconds) {
        super("Timeout exceeded (" + timeoutSeconds + "s)");
        this.timeoutSeconds = timeoutSeconds;
        this.elapsedSeconds = elapsedSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }
}
