package dev.queuectl;

import dev.queuectl.Models.JobState;

import java.time.Duration;
import java.time.Instant;

public final class RetryPolicy {
    // backoff_base^attempts is capped so huge exponents cannot overflow the timestamp
    static final long MAX_DELAY_SECONDS = Duration.ofDays(365).toSeconds();

    private RetryPolicy() {}

    public static Outcome onFailure(int attempts, int maxRetries, int backoffBase, Instant now, String errorMessage) {
        int next = attempts + 1;
        if (next > maxRetries) {
            return new Outcome(JobState.DEAD, next, null, errorMessage);
        }
        return new Outcome(JobState.FAILED, next, now.plusSeconds(delaySeconds(backoffBase, next)), errorMessage);
    }

    public static long delaySeconds(int backoffBase, int attempt) {
        if (backoffBase < 1) throw new IllegalArgumentException("backoff_base must be >= 1");
        long delay = 1;
        for (int i = 0; i < attempt; i++) {
            if (delay > MAX_DELAY_SECONDS / backoffBase) return MAX_DELAY_SECONDS;
            delay *= backoffBase;
        }
        return delay;
    }

    public static final class Outcome {
        public final JobState state;
        public final int attempts;
        public final Instant nextRetryAt;
        public final String errorMessage;

        Outcome(JobState state, int attempts, Instant nextRetryAt, String errorMessage) {
            this.state = state;
            this.attempts = attempts;
            this.nextRetryAt = nextRetryAt;
            this.errorMessage = errorMessage;
        }

        public boolean isDead() {
            return state == JobState.DEAD;
        }
    }
}
