package dev.queuectl;

import dev.queuectl.Models.Counts;
import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;

import java.util.List;

public class QueueManager {
    private final JobStore store;
    private final WorkerPool pool;
    private final Config config;

    public QueueManager(JobStore store, WorkerPool pool) {
        this.store = store;
        this.pool = pool;
        this.config = new Config(store);
    }

    /**
     * A job carrying the configured defaults for retries, backoff, timeout and priority.
     */
    public Job newJob(String id, String command) {
        Job j = new Job(id, command);
        j.max_retries = config.maxRetries();
        j.backoff_base = config.backoffBase();
        j.timeout = config.defaultTimeout();
        j.priority = config.defaultPriority();
        return j;
    }

    public Job enqueue(Job job) {
        return store.enqueue(job);
    }

    public List<Job> list(JobState state) {
        return store.list(state);
    }

    public Job show(String jobId) {
        Job job = store.get(jobId);
        if (job == null) throw new NotFoundException(jobId);
        return job;
    }

    public Counts status() {
        Counts c = store.counts();
        c.active_workers = pool.active().size();
        return c;
    }

    public void remove(String jobId) {
        if (!store.remove(jobId)) throw new NotFoundException(jobId);
    }

    public int clearAll() {
        return store.clear(null);
    }

    public List<Job> dlqList() {
        return store.list(JobState.DEAD);
    }

    public void dlqRetry(String jobId) {
        if (store.retryDead(jobId)) return;
        Job job = store.get(jobId);
        if (job == null) throw new NotFoundException(jobId);
        throw new StateException(jobId, JobState.DEAD, job.state);
    }

    public int dlqClear() {
        return store.clear(JobState.DEAD);
    }

    public Config config() {
        return config;
    }

    public List<WorkerPool.WorkerEntry> startWorkers(int count) {
        return pool.start(count);
    }

    public int stopWorkers() {
        return pool.stop();
    }

    public List<WorkerPool.WorkerEntry> workers() {
        return pool.active();
    }
}
