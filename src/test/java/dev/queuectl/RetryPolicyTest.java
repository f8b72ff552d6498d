package dev.queuectl;

import dev.queuectl.Models.JobState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    public void testExponentialDelays() {
        RetryPolicy.Outcome first = RetryPolicy.onFailure(0, 3, 2, NOW, "boom");
        assertEquals(JobState.FAILED, first.state);
        assertEquals(1, first.attempts);
        assertEquals(NOW.plusSeconds(2), first.nextRetryAt);
        assertEquals("boom", first.errorMessage);

        assertEquals(NOW.plusSeconds(4), RetryPolicy.onFailure(1, 3, 2, NOW, "boom").nextRetryAt);
        assertEquals(NOW.plusSeconds(8), RetryPolicy.onFailure(2, 3, 2, NOW, "boom").nextRetryAt);
    }

    @Test
    public void testAttemptPastMaxRetriesIsDead() {
        RetryPolicy.Outcome outcome = RetryPolicy.onFailure(3, 3, 2, NOW, "boom");
        assertTrue(outcome.isDead());
        assertEquals(4, outcome.attempts);
        assertNull(outcome.nextRetryAt);
    }

    @Test
    public void testZeroRetriesGoesStraightToDead() {
        assertTrue(RetryPolicy.onFailure(0, 0, 2, NOW, "boom").isDead());
    }

    @Test
    public void testBaseOneRetriesEverySecond() {
        assertEquals(1, RetryPolicy.delaySeconds(1, 5));
    }

    @Test
    public void testDelayIsCapped() {
        assertEquals(RetryPolicy.MAX_DELAY_SECONDS, RetryPolicy.delaySeconds(10, 40));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.delaySeconds(0, 1));
    }
}
