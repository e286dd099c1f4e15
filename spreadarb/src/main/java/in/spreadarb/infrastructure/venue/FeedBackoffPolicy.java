package in.spreadarb.infrastructure.venue;

import java.time.Duration;
import java.time.Instant;

/**
 * Backoff gate for a quote feed.
 *
 * Every failed request pushes the next allowed attempt further out, growing the delay by
 * {@code multiplier} up to {@code maxDelay}. After {@code maxFailures} consecutive failures the
 * circuit opens; an open circuit still lets one probe through every {@code maxDelay}.
 * A success resets everything.
 *
 * Usage:
 * <pre>
 * if (policy.allowsAttempt(now)) {
 *     try {
 *         fetch();
 *         policy.recordSuccess();
 *     } catch (Exception e) {
 *         policy.recordFailure(now);
 *     }
 * }
 * </pre>
 */
public class FeedBackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxFailures;

    private int failureCount = 0;
    private Duration currentDelay;
    private Instant nextAttemptAt;
    private boolean circuitOpen = false;

    private FeedBackoffPolicy(Duration initialDelay, Duration maxDelay,
                              double multiplier, int maxFailures) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxFailures = maxFailures;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if a request may be sent at {@code now}
     */
    public synchronized boolean allowsAttempt(Instant now) {
        return nextAttemptAt == null || !now.isBefore(nextAttemptAt);
    }

    /**
     * Record a failed request made at {@code now}.
     */
    public synchronized void recordFailure(Instant now) {
        failureCount++;
        if (failureCount >= maxFailures) {
            circuitOpen = true;
        }

        Duration wait = circuitOpen ? maxDelay : currentDelay;
        nextAttemptAt = now.plus(wait);

        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
    }

    public synchronized void recordSuccess() {
        failureCount = 0;
        currentDelay = initialDelay;
        nextAttemptAt = null;
        circuitOpen = false;
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * @return earliest instant a new request is allowed, or null when not backing off
     */
    public synchronized Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults for public ticker endpoints polled every few seconds.
     */
    public static FeedBackoffPolicy forTickerFeed() {
        return builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofMinutes(1))
            .multiplier(2.0)
            .maxFailures(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxFailures = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxFailures(int maxFailures) {
            if (maxFailures <= 0) {
                throw new IllegalArgumentException("Max failures must be positive");
            }
            this.maxFailures = maxFailures;
            return this;
        }

        public FeedBackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new FeedBackoffPolicy(initialDelay, maxDelay, multiplier, maxFailures);
        }
    }
}
