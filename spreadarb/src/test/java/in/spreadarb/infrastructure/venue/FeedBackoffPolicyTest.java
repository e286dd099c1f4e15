package in.spreadarb.infrastructure.venue;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedBackoffPolicy.
 *
 * Tests:
 * - Growing delay between attempts
 * - Circuit opening after consecutive failures
 * - Reset on success
 * - Builder validation
 */
class FeedBackoffPolicyTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static FeedBackoffPolicy policy() {
        return FeedBackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxFailures(3)
            .build();
    }

    @Test
    void testInitialState() {
        FeedBackoffPolicy policy = policy();

        assertTrue(policy.allowsAttempt(T0), "Should allow the first request");
        assertEquals(0, policy.getFailureCount());
        assertFalse(policy.isCircuitOpen(), "Circuit should be closed initially");
        assertNull(policy.getNextAttemptAt(), "No backoff yet");
    }

    @Test
    void testDelayGrowsAfterEachFailure() {
        FeedBackoffPolicy policy = policy();

        policy.recordFailure(T0);
        assertEquals(T0.plusSeconds(1), policy.getNextAttemptAt(), "First wait is the initial delay");
        assertFalse(policy.allowsAttempt(T0.plusMillis(500)));
        assertTrue(policy.allowsAttempt(T0.plusSeconds(1)));

        Instant t1 = T0.plusSeconds(1);
        policy.recordFailure(t1);
        assertEquals(t1.plusSeconds(2), policy.getNextAttemptAt(), "Second wait doubles");
        assertEquals(2, policy.getFailureCount());
        assertFalse(policy.isCircuitOpen());
    }

    @Test
    void testCircuitOpensAtMaxFailures() {
        FeedBackoffPolicy policy = policy();
        Instant t = T0;

        for (int i = 0; i < 3; i++) {
            policy.recordFailure(t);
        }

        assertTrue(policy.isCircuitOpen(), "Circuit should open after 3 failures");
        assertEquals(t.plusSeconds(5), policy.getNextAttemptAt(), "Open circuit waits the max delay");
        assertFalse(policy.allowsAttempt(t.plusSeconds(4)));
        assertTrue(policy.allowsAttempt(t.plusSeconds(5)), "Open circuit still lets a probe through");
    }

    @Test
    void testSuccessResets() {
        FeedBackoffPolicy policy = policy();
        policy.recordFailure(T0);
        policy.recordFailure(T0);
        policy.recordFailure(T0);

        policy.recordSuccess();

        assertEquals(0, policy.getFailureCount());
        assertFalse(policy.isCircuitOpen());
        assertNull(policy.getNextAttemptAt());
        assertTrue(policy.allowsAttempt(T0));

        policy.recordFailure(T0);
        assertEquals(T0.plusSeconds(1), policy.getNextAttemptAt(), "Delay restarts from the initial value");
    }

    @Test
    void testTickerFeedDefaults() {
        FeedBackoffPolicy policy = FeedBackoffPolicy.forTickerFeed();

        policy.recordFailure(T0);
        assertEquals(T0.plusSeconds(2), policy.getNextAttemptAt());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            FeedBackoffPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () ->
            FeedBackoffPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () ->
            FeedBackoffPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class, () ->
            FeedBackoffPolicy.builder().maxFailures(0));
        assertThrows(IllegalArgumentException.class, () ->
            FeedBackoffPolicy.builder()
                .initialDelay(Duration.ofMinutes(2))
                .maxDelay(Duration.ofMinutes(1))
                .build());
    }
}
