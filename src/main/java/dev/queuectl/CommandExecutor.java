package dev.queuectl;

public interface CommandExecutor {

    /**
     * @throws ExecutionTimeoutException if the command ran past {@code timeoutSeconds}; the process is killed
     * @throws LaunchException if the command could not be started
     */
    ExecutionResult execute(String command, int timeoutSeconds);

    final class ExecutionResult {
        public final int exitCode;
        public final String stdout;
        public final String stderr;
        public final double elapsedSeconds;

        public ExecutionResult(int exitCode, String stdout, String stderr, double elapsedSeconds) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.elapsedSeconds = elapsedSeconds;
        }

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
