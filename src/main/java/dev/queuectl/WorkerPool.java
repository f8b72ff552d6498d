package dev.queuectl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path registryFile;
    private final ProcessSupervisor supervisor;
    private final Clock clock;

    public WorkerPool(Path registryFile, ProcessSupervisor supervisor) {
        this(registryFile, supervisor, Clock.systemUTC());
    }

    public WorkerPool(Path registryFile, ProcessSupervisor supervisor, Clock clock) {
        this.registryFile = registryFile;
        this.supervisor = supervisor;
        this.clock = clock;
    }

    public static Path registryFor(Path dbPath) {
        Path parent = dbPath.toAbsolutePath().getParent();
        return parent == null ? Path.of("workers.json") : parent.resolve("workers.json");
    }

    /**
     * Starts {@code count} workers. Workers started before a launch failure stay registered.
     */
    public synchronized List<WorkerEntry> start(int count) {
        if (count < 1) throw new IllegalArgumentException("count must be >= 1");
        List<WorkerEntry> workers = prune(load());
        List<WorkerEntry> started = new ArrayList<>();
        try {
            for (int i = 0; i < count; i++) {
                String id = "worker-" + UUID.randomUUID().toString().substring(0, 8);
                WorkerEntry entry = supervisor.start(id);
                entry.started_at = Models.nowIso(clock);
                workers.add(entry);
                started.add(entry);
                log.info("Started worker {} (pid {})", id, entry.pid);
            }
        } finally {
            save(workers);
        }
        return started;
    }

    /**
     * Signals every registered worker to stop and empties the registry. Entries whose process is already
     * gone are dropped without error.
     *
     * @return number of workers that were signalled
     */
    public synchronized int stop() {
        List<WorkerEntry> workers = load();
        int stopped = 0;
        for (WorkerEntry w : workers) {
            if (supervisor.terminate(w)) {
                stopped++;
                log.info("Stopped worker {} (pid {})", w.worker_id, w.pid);
            } else {
                log.info("Worker {} (pid {}) was not running", w.worker_id, w.pid);
            }
        }
        save(new ArrayList<>());
        return stopped;
    }

    /**
     * Live workers; dead entries are removed from the registry as a side effect.
     */
    public synchronized List<WorkerEntry> active() {
        List<WorkerEntry> workers = load();
        List<WorkerEntry> alive = prune(workers);
        if (alive.size() != workers.size()) save(alive);
        return alive;
    }

    private List<WorkerEntry> prune(List<WorkerEntry> workers) {
        List<WorkerEntry> alive = new ArrayList<>();
        for (WorkerEntry w : workers) {
            if (supervisor.isAlive(w)) alive.add(w);
            else log.debug("Dropping stale worker entry {} (pid {})", w.worker_id, w.pid);
        }
        return alive;
    }

    private List<WorkerEntry> load() {
        if (!Files.exists(registryFile)) return new ArrayList<>();
        try {
            return new ArrayList<>(JSON.readValue(registryFile.toFile(), new TypeReference<List<WorkerEntry>>() {}));
        } catch (IOException e) {
            log.warn("Ignoring unreadable worker registry {}: {}", registryFile, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void save(List<WorkerEntry> workers) {
        try {
            Path parent = registryFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            JSON.writerWithDefaultPrettyPrinter().writeValue(registryFile.toFile(), workers);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write worker registry " + registryFile, e);
        }
    }

    public static class WorkerEntry {
        public String worker_id;
        public long pid;
        public String started_at;
        // epoch millis; null when the platform does not report process start times
        public Long process_start_ms;

        public WorkerEntry() {}

        public WorkerEntry(String workerId, long pid) {
            this.worker_id = workerId;
            this.pid = pid;
        }
    }
}
