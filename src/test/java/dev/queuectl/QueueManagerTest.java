package dev.queuectl;

import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class QueueManagerTest {
    @TempDir
    Path tempDir;

    private JobStore store;
    private WorkerPoolTest.FakeSupervisor supervisor;
    private QueueManager qm;

    @BeforeEach
    public void setUp() {
        store = new JobStore(tempDir.resolve("queue.db"));
        supervisor = new WorkerPoolTest.FakeSupervisor();
        qm = new QueueManager(store, new WorkerPool(tempDir.resolve("workers.json"), supervisor));
    }

    @Test
    public void testNewJobUsesConfiguredDefaults() {
        qm.config().set(Config.MAX_RETRIES, "5");
        qm.config().set(Config.BACKOFF_BASE, "3");
        qm.config().set(Config.DEFAULT_TIMEOUT, "60");
        qm.config().set(Config.DEFAULT_PRIORITY, "1");
        Job j = qm.enqueue(qm.newJob("a", "echo a"));
        assertEquals(5, j.max_retries);
        assertEquals(3, j.backoff_base);
        assertEquals(60, j.timeout);
        assertEquals(1, j.priority);
    }

    @Test
    public void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> qm.config().set("colour", "1"));
        assertThrows(IllegalArgumentException.class, () -> qm.config().set(Config.BACKOFF_BASE, "0"));
        assertThrows(IllegalArgumentException.class, () -> qm.config().set(Config.MAX_RETRIES, "many"));
        qm.config().set(Config.MAX_RETRIES, " 0 ");
        assertEquals(0, qm.config().maxRetries());
        assertEquals("0", qm.config().all().get(Config.MAX_RETRIES));
    }

    @Test
    public void testUnknownIdsAreReported() {
        assertThrows(NotFoundException.class, () -> qm.show("nope"));
        assertThrows(NotFoundException.class, () -> qm.remove("nope"));
        assertThrows(NotFoundException.class, () -> qm.dlqRetry("nope"));
    }

    @Test
    public void testDlqRetryRequiresDeadJob() {
        qm.enqueue(qm.newJob("a", "echo a"));
        StateException e = assertThrows(StateException.class, () -> qm.dlqRetry("a"));
        assertEquals(JobState.PENDING, e.getActual());
    }

    @Test
    public void testDlqLifecycle() {
        Job j = qm.newJob("a", "false");
        j.max_retries = 0;
        qm.enqueue(j);
        store.claim("w1");
        store.settleFailure("a", "Exit code 1", 0.0);
        assertEquals(1, qm.dlqList().size());

        qm.dlqRetry("a");
        assertTrue(qm.dlqList().isEmpty());
        assertEquals(JobState.PENDING, qm.show("a").state);

        store.claim("w1");
        store.settleFailure("a", "Exit code 1", 0.0);
        assertEquals(1, qm.dlqClear());
        assertTrue(qm.list(null).isEmpty());
    }

    @Test
    public void testStatusIncludesWorkers() {
        qm.enqueue(qm.newJob("a", "echo a"));
        qm.startWorkers(2);
        Models.Counts status = qm.status();
        assertEquals(1, status.pending);
        assertEquals(2, status.active_workers);
        assertEquals(2, qm.stopWorkers());
        assertEquals(0, qm.status().active_workers);
    }
}
