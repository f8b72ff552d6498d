package dev.queuectl;

import dev.queuectl.Models.Counts;
import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every read-modify-write (enqueue, claim, settle, DLQ retry) runs inside one {@code BEGIN IMMEDIATE}
 * transaction; readers see the last committed WAL snapshot.
 */
public class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private static final int BUSY_RETRIES = 20;
    private static final long BUSY_SLEEP_MS = 100L;
    private static final int BUSY_TIMEOUT_MS = 5000;

    public static final Map<String, String> CONFIG_DEFAULTS = Map.of(
        Config.MAX_RETRIES, "3",
        Config.BACKOFF_BASE, "2",
        Config.DEFAULT_TIMEOUT, "20",
        Config.DEFAULT_PRIORITY, "5"
    );

    private final Path dbPath;
    private final String url;
    private final Clock clock;

    public JobStore(Path dbPath) {
        this(dbPath, Clock.systemUTC());
    }

    public JobStore(Path dbPath, Clock clock) {
        this.dbPath = dbPath.toAbsolutePath();
        this.url = "jdbc:sqlite:" + this.dbPath;
        this.clock = clock;
        try {
            Path parent = this.dbPath.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory for " + this.dbPath, e);
        }
        init();
    }

    public Path dbPath() {
        return dbPath;
    }

    Connection getConn() throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(BUSY_TIMEOUT_MS);
        cfg.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return cfg.createConnection(url);
    }

    private void init() {
        // journal mode is persistent in the file and cannot be changed inside a transaction
        try (Connection c = getConn(); Statement s = c.createStatement()) {
            String mode;
            try (ResultSet rs = s.executeQuery("PRAGMA journal_mode")) {
                mode = rs.next() ? rs.getString(1) : "";
            }
            if (!"wal".equalsIgnoreCase(mode)) s.execute("PRAGMA journal_mode=WAL");
        } catch (SQLException e) {
            throw new StorageException("enable WAL on " + dbPath, e);
        }
        inTransaction("init schema", c -> {
            try (Statement s = c.createStatement()) {
                s.executeUpdate(
                    "CREATE TABLE IF NOT EXISTS jobs (" +
                        "id TEXT PRIMARY KEY, " +
                        "command TEXT NOT NULL, " +
                        "state TEXT NOT NULL DEFAULT 'pending', " +
                        "attempts INTEGER NOT NULL DEFAULT 0, " +
                        "max_retries INTEGER NOT NULL DEFAULT 3, " +
                        "timeout INTEGER NOT NULL DEFAULT 20, " +
                        "backoff_base INTEGER NOT NULL DEFAULT 2, " +
                        "priority INTEGER NOT NULL DEFAULT 0, " +
                        "waiting_time INTEGER NOT NULL DEFAULT 0, " +
                        "created_at TEXT NOT NULL, " +
                        "updated_at TEXT NOT NULL, " +
                        "next_retry_at TEXT, " +
                        "error_message TEXT, " +
                        "output TEXT, " +
                        "execution_time REAL, " +
                        "locked_by TEXT, " +
                        "locked_at TEXT)"
                );
                s.executeUpdate("CREATE TABLE IF NOT EXISTS config (key TEXT PRIMARY KEY, value TEXT NOT NULL)");
                s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_jobs_state ON jobs(state)");
                s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_jobs_next_retry ON jobs(next_retry_at)");
                s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_jobs_priority ON jobs(priority DESC, created_at ASC)");
                s.executeUpdate("CREATE INDEX IF NOT EXISTS idx_jobs_locked ON jobs(locked_by)");
            }
            try (PreparedStatement ps = c.prepareStatement("INSERT OR IGNORE INTO config (key, value) VALUES (?, ?)")) {
                for (Map.Entry<String, String> e : CONFIG_DEFAULTS.entrySet()) {
                    ps.setString(1, e.getKey());
                    ps.setString(2, e.getValue());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
    }

    /**
     * Inserts a new PENDING job and ages every waiting job by one in the same transaction.
     *
     * @throws DuplicateIdException if a job with the same id exists
     */
    public Job enqueue(Job job) {
        validate(job);
        return inTransaction("enqueue " + job.id, c -> {
            if (find(c, job.id) != null) throw new DuplicateIdException(job.id);
            String now = Models.nowIso(clock);
            try (PreparedStatement age = c.prepareStatement(
                "UPDATE jobs SET waiting_time = waiting_time + 1 WHERE state IN ('pending', 'failed')")) {
                age.executeUpdate();
            }
            try (PreparedStatement ins = c.prepareStatement(
                "INSERT INTO jobs (id, command, state, attempts, max_retries, timeout, backoff_base, priority, " +
                    "waiting_time, created_at, updated_at) VALUES (?, ?, 'pending', 0, ?, ?, ?, ?, 0, ?, ?)")) {
                ins.setString(1, job.id);
                ins.setString(2, job.command);
                ins.setInt(3, job.max_retries);
                ins.setInt(4, job.timeout);
                ins.setInt(5, job.backoff_base);
                ins.setInt(6, job.priority);
                ins.setString(7, now);
                ins.setString(8, now);
                ins.executeUpdate();
            }
            return find(c, job.id);
        });
    }

    private static void validate(Job job) {
        if (job.id == null || job.id.isBlank()) throw new IllegalArgumentException("id is required");
        if (job.command == null || job.command.isBlank()) throw new IllegalArgumentException("command is required");
        if (job.max_retries < 0) throw new IllegalArgumentException("max_retries must be >= 0");
        if (job.timeout < 1) throw new IllegalArgumentException("timeout must be >= 1 second");
        if (job.backoff_base < 1) throw new IllegalArgumentException("backoff_base must be >= 1");
    }

    /**
     * Claims the best claimable job for {@code workerId}.
     * <p>
     * Selection and the conditional {@code locked_by IS NULL} update share one IMMEDIATE transaction.
     * Losing the update to another writer yields {@code null}, same as an empty queue.
     *
     * @return the claimed job in PROCESSING state, or {@code null} if none is available
     */
    public Job claim(String workerId) {
        if (workerId == null || workerId.isBlank()) throw new IllegalArgumentException("workerId is required");
        return inTransaction("claim", c -> {
            String now = Models.nowIso(clock);
            String id;
            try (PreparedStatement sel = c.prepareStatement(
                "SELECT id FROM jobs WHERE " + Scheduler.CLAIMABLE_SQL + " ORDER BY " + Scheduler.ORDER_SQL + " LIMIT 1")) {
                sel.setString(1, now);
                try (ResultSet rs = sel.executeQuery()) {
                    if (!rs.next()) return null;
                    id = rs.getString(1);
                }
            }
            int updated;
            try (PreparedStatement upd = c.prepareStatement(
                "UPDATE jobs SET state = 'processing', locked_by = ?, locked_at = ?, next_retry_at = NULL, updated_at = ? " +
                    "WHERE id = ? AND locked_by IS NULL AND state IN ('pending', 'failed')")) {
                upd.setString(1, workerId);
                upd.setString(2, now);
                upd.setString(3, now);
                upd.setString(4, id);
                updated = upd.executeUpdate();
            }
            if (updated != 1) {
                log.debug("Worker {} lost the race for job {}", workerId, id);
                return null;
            }
            return find(c, id);
        });
    }

    public void settleSuccess(String jobId, String output, Double executionTime) {
        settleSuccess(jobId, output, executionTime, null);
    }

    /**
     * PROCESSING to COMPLETED. When {@code workerId} is non-null the lock must also belong to it.
     *
     * @throws NotFoundException if the job does not exist
     * @throws StateException if the job is not PROCESSING (or is locked by someone else)
     */
    public void settleSuccess(String jobId, String output, Double executionTime, String workerId) {
        inTransaction("settle success " + jobId, c -> {
            String now = Models.nowIso(clock);
            int updated;
            try (PreparedStatement ps = c.prepareStatement(
                "UPDATE jobs SET state = 'completed', output = ?, execution_time = ?, next_retry_at = NULL, " +
                    "locked_by = NULL, locked_at = NULL, updated_at = ? " +
                    "WHERE id = ? AND state = 'processing' AND (? IS NULL OR locked_by = ?)")) {
                ps.setString(1, output);
                setDouble(ps, 2, executionTime);
                ps.setString(3, now);
                ps.setString(4, jobId);
                ps.setString(5, workerId);
                ps.setString(6, workerId);
                updated = ps.executeUpdate();
            }
            if (updated != 1) throw rejection(find(c, jobId), jobId, workerId);
            return null;
        });
    }

    public RetryPolicy.Outcome settleFailure(String jobId, String errorMessage, Double executionTime) {
        return settleFailure(jobId, errorMessage, executionTime, null);
    }

    /**
     * PROCESSING to FAILED (retry scheduled) or DEAD, as decided by {@link RetryPolicy}. Lock fields are
     * cleared either way.
     *
     * @throws NotFoundException if the job does not exist
     * @throws StateException if the job is not PROCESSING (or is locked by someone else)
     */
    public RetryPolicy.Outcome settleFailure(String jobId, String errorMessage, Double executionTime, String workerId) {
        return inTransaction("settle failure " + jobId, c -> {
            Job job = find(c, jobId);
            if (job == null || job.state != JobState.PROCESSING || (workerId != null && !workerId.equals(job.locked_by))) {
                throw rejection(job, jobId, workerId);
            }
            RetryPolicy.Outcome outcome = RetryPolicy.onFailure(
                job.attempts, job.max_retries, job.backoff_base, clock.instant(), errorMessage);
            try (PreparedStatement ps = c.prepareStatement(
                "UPDATE jobs SET state = ?, attempts = ?, error_message = ?, execution_time = ?, next_retry_at = ?, " +
                    "locked_by = NULL, locked_at = NULL, updated_at = ? WHERE id = ? AND state = 'processing'")) {
                ps.setString(1, outcome.state.dbValue());
                ps.setInt(2, outcome.attempts);
                ps.setString(3, outcome.errorMessage);
                setDouble(ps, 4, executionTime);
                ps.setString(5, Models.iso(outcome.nextRetryAt));
                ps.setString(6, Models.nowIso(clock));
                ps.setString(7, jobId);
                ps.executeUpdate();
            }
            return outcome;
        });
    }

    private static QueueException rejection(Job job, String jobId, String workerId) {
        if (job == null) return new NotFoundException(jobId);
        if (job.state != JobState.PROCESSING) return new StateException(jobId, JobState.PROCESSING, job.state);
        return new StateException(jobId, "locked by " + job.locked_by + ", not " + workerId);
    }

    /**
     * DEAD to PENDING with attempts reset.
     *
     * @return false if the job is missing or not DEAD
     */
    public boolean retryDead(String jobId) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(
            "UPDATE jobs SET state = 'pending', attempts = 0, error_message = NULL, next_retry_at = NULL, " +
                "locked_by = NULL, locked_at = NULL, updated_at = ? WHERE id = ? AND state = 'dead'")) {
            ps.setString(1, Models.nowIso(clock));
            ps.setString(2, jobId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StorageException("retry " + jobId, e);
        }
    }

    /**
     * @return false if no such job exists
     */
    public boolean remove(String jobId) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("remove " + jobId, e);
        }
    }

    /**
     * Deletes every job in {@code state}, or every job when {@code state} is null.
     *
     * @return number of deleted jobs
     */
    public int clear(JobState state) {
        String sql = state == null ? "DELETE FROM jobs" : "DELETE FROM jobs WHERE state = ?";
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (state != null) ps.setString(1, state.dbValue());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("clear", e);
        }
    }

    public Job get(String jobId) {
        try (Connection c = getConn()) {
            return find(c, jobId);
        } catch (SQLException e) {
            throw new StorageException("get " + jobId, e);
        }
    }

    public List<Job> list(JobState state) {
        String sql = state == null
            ? "SELECT * FROM jobs ORDER BY created_at ASC, rowid ASC"
            : "SELECT * FROM jobs WHERE state = ? ORDER BY created_at ASC, rowid ASC";
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (state != null) ps.setString(1, state.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                List<Job> out = new ArrayList<>();
                while (rs.next()) out.add(map(rs));
                return out;
            }
        } catch (SQLException e) {
            throw new StorageException("list", e);
        }
    }

    public Counts counts() {
        Counts cts = new Counts();
        try (Connection c = getConn();
             PreparedStatement ps = c.prepareStatement("SELECT state, COUNT(1) FROM jobs GROUP BY state");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                cts.set(JobState.of(rs.getString(1)), rs.getInt(2));
            }
        } catch (SQLException e) {
            throw new StorageException("counts", e);
        }
        return cts;
    }

    public String getConfig(String key) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement("SELECT value FROM config WHERE key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new StorageException("config get " + key, e);
        }
    }

    public void setConfig(String key, String value) {
        try (Connection c = getConn(); PreparedStatement ps = c.prepareStatement(
            "INSERT INTO config (key, value) VALUES (?, ?) ON CONFLICT(key) DO UPDATE SET value = excluded.value")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("config set " + key, e);
        }
    }

    public Map<String, String> configEntries() {
        try (Connection c = getConn();
             PreparedStatement ps = c.prepareStatement("SELECT key, value FROM config ORDER BY key");
             ResultSet rs = ps.executeQuery()) {
            Map<String, String> out = new LinkedHashMap<>();
            while (rs.next()) out.put(rs.getString(1), rs.getString(2));
            return out;
        } catch (SQLException e) {
            throw new StorageException("config list", e);
        }
    }

    private static Job find(Connection c, String jobId) throws SQLException {
        try (PreparedStatement get = c.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            get.setString(1, jobId);
            try (ResultSet rs = get.executeQuery()) {
                return rs.next() ? map(rs) : null;
            }
        }
    }

    private static Job map(ResultSet r) throws SQLException {
        Job j = new Job();
        j.id = r.getString("id");
        j.command = r.getString("command");
        j.state = JobState.of(r.getString("state"));
        j.attempts = r.getInt("attempts");
        j.max_retries = r.getInt("max_retries");
        j.timeout = r.getInt("timeout");
        j.backoff_base = r.getInt("backoff_base");
        j.priority = r.getInt("priority");
        j.waiting_time = r.getInt("waiting_time");
        j.created_at = r.getString("created_at");
        j.updated_at = r.getString("updated_at");
        j.next_retry_at = r.getString("next_retry_at");
        j.error_message = r.getString("error_message");
        j.output = r.getString("output");
        double et = r.getDouble("execution_time");
        j.execution_time = r.wasNull() ? null : et;
        j.locked_by = r.getString("locked_by");
        j.locked_at = r.getString("locked_at");
        return j;
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) ps.setNull(index, Types.REAL);
        else ps.setDouble(index, value);
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    private <T> T inTransaction(String what, SqlWork<T> work) {
        for (int attempt = 1; ; attempt++) {
            try (Connection c = getConn()) {
                c.setAutoCommit(false);
                try {
                    T result = work.apply(c);
                    c.commit();
                    return result;
                } catch (SQLException | RuntimeException e) {
                    c.rollback();
                    throw e;
                }
            } catch (SQLException e) {
                if (isBusy(e) && attempt < BUSY_RETRIES) {
                    log.debug("Database busy during {}, retry {}/{}", what, attempt, BUSY_RETRIES);
                    sleepQuiet(BUSY_SLEEP_MS);
                    continue;
                }
                throw new StorageException(what, e);
            }
        }
    }

    private static boolean isBusy(SQLException e) {
        String msg = e.getMessage();
        return msg != null && (msg.contains("database is locked") || msg.contains("SQLITE_BUSY"));
    }

    private static void sleepQuiet(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
