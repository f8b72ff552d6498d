package dev.queuectl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class ShellCommandExecutor implements CommandExecutor {
    private static final boolean WINDOWS = isWindows(System.getProperty("os.name", ""));

    private final List<String> shell;

    public ShellCommandExecutor() {
        this(WINDOWS ? List.of("cmd.exe", "/c") : List.of("sh", "-c"));
    }

    public ShellCommandExecutor(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    static boolean isWindows(String osName) {
        return osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }

    // output goes to temp files, not pipes, so a chatty command cannot block
    @Override
    public ExecutionResult execute(String command, int timeoutSeconds) {
        List<String> argv = new ArrayList<>(shell);
        argv.add(command);
        Path out = null;
        Path err = null;
        Process process = null;
        long start = System.nanoTime();
        try {
            out = Files.createTempFile("queuectl-", ".out");
            err = Files.createTempFile("queuectl-", ".err");
            try {
                process = new ProcessBuilder(argv)
                    .redirectInput(ProcessBuilder.Redirect.from(new File(WINDOWS ? "NUL" : "/dev/null")))
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile())
                    .start();
            } catch (IOException e) {
                throw new LaunchException(command, e);
            }
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                kill(process);
                throw new ExecutionTimeoutException(timeoutSeconds, elapsed(start));
            }
            return new ExecutionResult(process.exitValue(), read(out), read(err), elapsed(start));
        } catch (InterruptedException e) {
            if (process != null) destroyTree(process);
            Thread.currentThread().interrupt();
            throw new QueueException("Interrupted while running '" + command + "'", e);
        } catch (IOException e) {
            throw new LaunchException(command, e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private static void kill(Process process) throws InterruptedException {
        destroyTree(process);
        process.waitFor(5, TimeUnit.SECONDS);
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).strip();
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            file.toFile().deleteOnExit();
        }
    }
}
