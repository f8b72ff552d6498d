package dev.queuectl;

import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentClaimTest {
    private static final int JOBS = 40;
    private static final int WORKERS = 8;

    @TempDir
    Path tempDir;

    @Test
    public void testEveryJobClaimedExactlyOnce() throws Exception {
        JobStore store = new JobStore(tempDir.resolve("queue.db"));
        for (int i = 0; i < JOBS; i++) {
            Job j = new Job("job-" + i, "true");
            j.priority = i % 5;
            store.enqueue(j);
        }

        Map<String, String> claimedBy = new ConcurrentHashMap<>();
        AtomicInteger duplicates = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < WORKERS; w++) {
            String workerId = "worker-" + w;
            futures.add(pool.submit(() -> {
                // each worker gets its own store instance, like separate processes would
                JobStore own = new JobStore(tempDir.resolve("queue.db"));
                go.await();
                while (true) {
                    Job job = own.claim(workerId);
                    if (job == null) {
                        if (own.counts().pending == 0) return null;
                        continue;
                    }
                    assertEquals(workerId, job.locked_by);
                    if (claimedBy.putIfAbsent(job.id, workerId) != null) duplicates.incrementAndGet();
                    own.settleSuccess(job.id, "ok", 0.0, workerId);
                }
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(0, duplicates.get());
        assertEquals(JOBS, claimedBy.size());
        assertEquals(JOBS, store.list(JobState.COMPLETED).size());
    }

    @Test
    public void testRacingClaimsOnSingleJob() throws Exception {
        JobStore store = new JobStore(tempDir.resolve("single.db"));
        store.enqueue(new Job("only", "true"));

        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        List<Future<Job>> results = new ArrayList<>();
        for (int w = 0; w < WORKERS; w++) {
            String workerId = "worker-" + w;
            results.add(pool.submit(() -> {
                go.await();
                return store.claim(workerId);
            }));
        }
        go.countDown();
        int winners = 0;
        for (Future<Job> f : results) {
            if (f.get(30, TimeUnit.SECONDS) != null) winners++;
        }
        pool.shutdown();

        assertEquals(1, winners);
        assertEquals(JobState.PROCESSING, store.get("only").state);
    }
}
