package dev.queuectl;

public class LaunchException extends QueueException {
    public LaunchException(String command, Throwable cause) {
        super("Failed to launch '" + command + "': " + cause.getMessage(), cause);
    }
}
