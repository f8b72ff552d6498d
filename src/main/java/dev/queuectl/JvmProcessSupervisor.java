package dev.queuectl;

import dev.queuectl.WorkerPool.WorkerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public class JvmProcessSupervisor implements ProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(JvmProcessSupervisor.class);

    private final Path dbPath;
    private final Path logDir;

    public JvmProcessSupervisor(Path dbPath) {
        this.dbPath = dbPath.toAbsolutePath();
        Path parent = this.dbPath.getParent();
        this.logDir = parent == null ? Path.of("logs") : parent.resolve("logs");
    }

    @Override
    public WorkerEntry start(String workerId) {
        String java = System.getProperty("java.home") + File.separator + "bin" + File.separator + "java";
        String cp = System.getProperty("java.class.path");
        List<String> argv = List.of(java, "-cp", cp, Cli.class.getName(),
            "--db", dbPath.toString(), "worker", "run", "--id", workerId);
        try {
            Files.createDirectories(logDir);
            File logFile = logDir.resolve(workerId + ".log").toFile();
            Process process = new ProcessBuilder(argv)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile))
                .start();
            WorkerEntry entry = new WorkerEntry(workerId, process.pid());
            entry.process_start_ms = process.info().startInstant().map(Instant::toEpochMilli).orElse(null);
            return entry;
        } catch (IOException e) {
            throw new LaunchException("worker " + workerId, e);
        }
    }

    @Override
    public boolean isAlive(WorkerEntry worker) {
        return handle(worker).isPresent();
    }

    @Override
    public boolean terminate(WorkerEntry worker) {
        return handle(worker).map(ProcessHandle::destroy).orElse(false);
    }

    private Optional<ProcessHandle> handle(WorkerEntry worker) {
        Optional<ProcessHandle> live = ProcessHandle.of(worker.pid).filter(ProcessHandle::isAlive);
        if (live.isPresent() && !isSameProcess(live.get(), worker)) {
            log.debug("pid {} no longer belongs to worker {}", worker.pid, worker.worker_id);
            return Optional.empty();
        }
        return live;
    }

    static boolean isSameProcess(ProcessHandle process, WorkerEntry worker) {
        ProcessHandle.Info info = process.info();
        Optional<Instant> started = info.startInstant();
        if (worker.process_start_ms != null && started.isPresent()) {
            return started.get().toEpochMilli() == worker.process_start_ms;
        }
        // no start time to compare, fall back to the worker's command line
        String[] args = info.arguments().orElse(new String[0]);
        for (int i = 0; i + 1 < args.length; i++) {
            if ("--id".equals(args[i])) return worker.worker_id.equals(args[i + 1]);
        }
        return false;
    }
}
