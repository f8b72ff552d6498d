package dev.queuectl;

import dev.queuectl.CommandExecutor.ExecutionResult;
import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

public class WorkerTest {
    @TempDir
    Path tempDir;

    private JobStore store;

    @BeforeEach
    public void setUp() {
        store = new JobStore(tempDir.resolve("queue.db"));
    }

    private Worker worker(CommandExecutor executor) {
        return new Worker("w-test", store, executor, Duration.ofMillis(20));
    }

    private void enqueue(String id, int maxRetries) {
        Job j = new Job(id, "run " + id);
        j.max_retries = maxRetries;
        j.timeout = 1;
        store.enqueue(j);
    }

    @Test
    public void testRunOnceReturnsFalseOnEmptyQueue() {
        assertFalse(worker((c, t) -> fail("nothing to execute")).runOnce());
    }

    @Test
    public void testSuccessfulJobIsCompleted() {
        enqueue("ok", 3);
        assertTrue(worker((c, t) -> new ExecutionResult(0, "out of " + c, "", 0.5)).runOnce());
        Job done = store.get("ok");
        assertEquals(JobState.COMPLETED, done.state);
        assertEquals("out of run ok", done.output);
        assertEquals(0.5, done.execution_time, 1e-9);
        assertNull(done.locked_by);
    }

    @Test
    public void testNonZeroExitSchedulesRetry() {
        enqueue("bad", 3);
        worker((c, t) -> new ExecutionResult(2, "", "boom", 0.1)).runOnce();
        Job failed = store.get("bad");
        assertEquals(JobState.FAILED, failed.state);
        assertEquals(1, failed.attempts);
        assertEquals("Exit code 2: boom", failed.error_message);
        assertNotNull(failed.next_retry_at);
        assertNull(failed.locked_by);
    }

    @Test
    public void testTimeoutIsTreatedAsFailure() {
        enqueue("slow", 3);
        worker((c, t) -> { throw new ExecutionTimeoutException(t, 1.02); }).runOnce();
        Job failed = store.get("slow");
        assertEquals(JobState.FAILED, failed.state);
        assertEquals("Timeout exceeded (1s)", failed.error_message);
        assertEquals(1.02, failed.execution_time, 1e-9);
    }

    @Test
    public void testLaunchFailureWithNoRetriesGoesToDlq() {
        enqueue("broken", 0);
        worker((c, t) -> { throw new LaunchException(c, new IOException("no such file")); }).runOnce();
        Job dead = store.get("broken");
        assertEquals(JobState.DEAD, dead.state);
        assertEquals(1, dead.attempts);
        assertTrue(dead.error_message.contains("no such file"));
    }

    @Test
    public void testUnexpectedExecutorErrorDoesNotEscape() {
        enqueue("weird", 3);
        assertTrue(worker((c, t) -> { throw new IllegalStateException("kaput"); }).runOnce());
        assertEquals("Exception: kaput", store.get("weird").error_message);
    }

    @Test
    public void testSettleRejectionIsContained() {
        enqueue("gone", 3);
        // the job disappears while it is running
        Worker w = worker((c, t) -> {
            store.remove("gone");
            return new ExecutionResult(0, "", "", 0.0);
        });
        assertTrue(w.runOnce());
        assertNull(store.get("gone"));
    }

    @Test
    public void testLoopDrainsQueueAndStops() throws Exception {
        Worker w = worker((c, t) -> new ExecutionResult(0, c, "", 0.01));
        Thread thread = new Thread(w, "worker-loop");
        thread.start();
        for (int i = 0; i < 5; i++) enqueue("job-" + i, 3);

        await().atMost(10, TimeUnit.SECONDS).until(() -> store.counts().completed == 5);
        w.stop();
        assertTrue(w.awaitTermination(Duration.ofSeconds(5)));
        thread.join(5000);
        assertFalse(thread.isAlive());
    }

    @Test
    public void testLoopSurvivesUnexpectedStoreError() throws Exception {
        AtomicInteger claims = new AtomicInteger();
        JobStore flaky = new JobStore(tempDir.resolve("queue.db")) {
            @Override
            public Job claim(String workerId) {
                if (claims.incrementAndGet() == 1) throw new IllegalStateException("corrupt row");
                return super.claim(workerId);
            }
        };
        Worker w = new Worker("w-test", flaky, (c, t) -> new ExecutionResult(0, "ok", "", 0.01), Duration.ofMillis(20));
        enqueue("after-error", 3);
        Thread thread = new Thread(w, "worker-loop");
        thread.start();

        await().atMost(10, TimeUnit.SECONDS).until(() -> store.get("after-error").state == JobState.COMPLETED);
        assertTrue(claims.get() >= 2);
        assertTrue(thread.isAlive());
        w.stop();
        assertTrue(w.awaitTermination(Duration.ofSeconds(5)));
    }

    @Test
    public void testStopFinishesInFlightJobAndClaimsNothingMore() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Worker w = worker((c, t) -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ExecutionResult(0, "done", "", 0.2);
        });
        enqueue("first", 3);
        Thread thread = new Thread(w, "worker-loop");
        thread.start();

        assertTrue(started.await(10, TimeUnit.SECONDS));
        enqueue("second", 3);
        w.stop();
        assertFalse(w.awaitTermination(Duration.ofMillis(100)), "loop exited with a job in flight");
        release.countDown();

        assertTrue(w.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(JobState.COMPLETED, store.get("first").state);
        assertEquals(JobState.PENDING, store.get("second").state);
    }
}
