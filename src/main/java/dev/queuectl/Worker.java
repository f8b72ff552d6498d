package dev.queuectl;

import dev.queuectl.CommandExecutor.ExecutionResult;
import dev.queuectl.Models.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final String workerId;
    private final JobStore store;
    private final CommandExecutor executor;
    private final Duration pollInterval;

    private final AtomicBoolean shouldStop = new AtomicBoolean(false);
    private final CountDownLatch wakeUp = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    public Worker(String workerId, JobStore store, CommandExecutor executor) {
        this(workerId, store, executor, DEFAULT_POLL_INTERVAL);
    }

    public Worker(String workerId, JobStore store, CommandExecutor executor, Duration pollInterval) {
        this.workerId = workerId != null ? workerId : newId();
        this.store = store;
        this.executor = executor;
        this.pollInterval = pollInterval;
    }

    public static String newId() {
        return "worker-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String id() {
        return workerId;
    }

    @Override
    public void run() {
        log.info("Worker {} started (pid {}), polling every {} ms",
            workerId, ProcessHandle.current().pid(), pollInterval.toMillis());
        try {
            while (!shouldStop.get()) {
                boolean worked;
                try {
                    worked = runOnce();
                } catch (QueueException e) {
                    log.error("Worker {} failed to talk to the store", workerId, e);
                    worked = false;
                } catch (RuntimeException e) {
                    log.error("Worker {} hit an unexpected error, continuing", workerId, e);
                    worked = false;
                }
                if (!worked) pause();
            }
        } finally {
            log.info("Worker {} stopped", workerId);
            finished.countDown();
        }
    }

    /**
     * Claims and processes at most one job.
     *
     * @return true if a job was processed
     */
    public boolean runOnce() {
        Job job = store.claim(workerId);
        if (job == null) return false;
        process(job);
        return true;
    }

    void process(Job job) {
        log.info("Worker {} claimed job {} (attempt {}/{}, effective priority {}, timeout {}s): {}",
            workerId, job.id, job.attempts + 1, job.max_retries + 1, job.effectivePriority(), job.timeout, job.command);

        ExecutionResult result = null;
        String error;
        Double elapsed;
        try {
            result = executor.execute(job.command, job.timeout);
            elapsed = result.elapsedSeconds;
            error = result.succeeded() ? null : describe(result);
        } catch (ExecutionTimeoutException e) {
            elapsed = e.getElapsedSeconds();
            error = e.getMessage();
        } catch (LaunchException e) {
            elapsed = null;
            error = e.getMessage();
        } catch (RuntimeException e) {
            elapsed = null;
            error = "Exception: " + e.getMessage();
        }

        try {
            if (error == null) {
                store.settleSuccess(job.id, result.stdout, elapsed, workerId);
                log.info("Worker {} completed job {} in {} s", workerId, job.id, String.format("%.3f", elapsed));
            } else {
                RetryPolicy.Outcome outcome = store.settleFailure(job.id, error, elapsed, workerId);
                if (outcome.isDead()) {
                    log.warn("Worker {}: job {} failed ({}), moved to DLQ after {} attempts",
                        workerId, job.id, error, outcome.attempts);
                } else {
                    log.warn("Worker {}: job {} failed ({}), retry {} at {}",
                        workerId, job.id, error, outcome.attempts + 1, Models.iso(outcome.nextRetryAt));
                }
            }
        } catch (StateException | NotFoundException e) {
            log.warn("Worker {} could not settle job {}: {}", workerId, job.id, e.getMessage());
        }
    }

    private static String describe(ExecutionResult result) {
        String msg = "Exit code " + result.exitCode;
        return result.stderr == null || result.stderr.isEmpty() ? msg : msg + ": " + result.stderr;
    }

    private void pause() {
        try {
            wakeUp.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shouldStop.set(true);
        }
    }

    /**
     * Requests the loop to exit after the job in flight, if any, has been settled.
     */
    public void stop() {
        shouldStop.set(true);
        wakeUp.countDown();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs the loop on the calling thread; SIGTERM/SIGINT stop it gracefully and the JVM waits for the
     * in-flight job to settle before exiting.
     */
    public void runUntilSignalled() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            stop();
            try {
                finished.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, workerId + "-shutdown"));
        run();
    }
}
