package dev.queuectl;

import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Job selection policy: highest {@code priority + waiting_time} first, oldest {@code created_at} on ties.
 * <p>
 * {@link JobStore#claim(String)} evaluates the same policy in SQL through {@link #CLAIMABLE_SQL} and
 * {@link #ORDER_SQL}; the in-memory form here is what tools and tests reason with.
 */
public final class Scheduler {
    /** Bind the current timestamp as the only parameter. */
    public static final String CLAIMABLE_SQL =
        "(state = 'pending' OR (state = 'failed' AND next_retry_at IS NOT NULL AND next_retry_at <= ?)) AND locked_by IS NULL";

    public static final String ORDER_SQL = "(priority + waiting_time) DESC, created_at ASC, rowid ASC";

    public static final Comparator<Job> ORDER = Comparator
        .comparingInt(Scheduler::effectivePriority).reversed()
        .thenComparing(j -> j.created_at, Comparator.nullsLast(Comparator.naturalOrder()));

    private Scheduler() {}

    public static int effectivePriority(Job job) {
        return job.priority + job.waiting_time;
    }

    public static boolean isClaimable(Job job, Instant now) {
        if (job.locked_by != null) return false;
        if (job.state == JobState.PENDING) return true;
        if (job.state != JobState.FAILED || job.next_retry_at == null) return false;
        return !Models.parse(job.next_retry_at).isAfter(now);
    }

    public static Optional<Job> select(Collection<Job> jobs, Instant now) {
        return jobs.stream()
            .filter(j -> isClaimable(j, now))
            .min(ORDER);
    }
}
