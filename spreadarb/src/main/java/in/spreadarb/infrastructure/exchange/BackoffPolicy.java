package in.spreadarb.infrastructure.exchange;

import java.time.Duration;
import java.time.Instant;

/**
 * Consecutive-failure tracker with exponential backoff for exchange calls.
 *
 * Features:
 * - A number of tolerated failures before any backoff is applied
 * - Exponential delay growth with a cap
 * - A failure budget after which the caller should give up
 * - Reset on the first success
 *
 * Usage (order submission):
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.forOrderSubmission(2);
 * while (true) {
 *     try {
 *         return submit();
 *     } catch (ExchangeUnavailableException e) {
 *         policy.recordFailure();
 *         if (policy.isExhausted()) throw e;
 *         Thread.sleep(policy.nextDelay().toMillis());
 *     }
 * }
 * </pre>
 */
public final class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxFailures;
    private final int toleratedFailures;

    private int consecutiveFailures = 0;
    private Duration currentDelay = Duration.ZERO;
    private Instant lastFailureAt;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                          int maxFailures, int toleratedFailures) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxFailures = maxFailures;
        this.toleratedFailures = toleratedFailures;
    }

    /**
     * Register a failed call and grow the delay once past the tolerated count.
     */
    public synchronized void recordFailure() {
        consecutiveFailures++;
        lastFailureAt = Instant.now();

        int steps = consecutiveFailures - toleratedFailures;
        if (steps <= 0) {
            currentDelay = Duration.ZERO;
        } else if (steps == 1) {
            currentDelay = min(initialDelay, maxDelay);
        } else {
            long grown = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        }
    }

    public synchronized void recordSuccess() {
        consecutiveFailures = 0;
        currentDelay = Duration.ZERO;
        lastFailureAt = null;
    }

    /**
     * Extra wait before the next call; zero while within the tolerated failures.
     */
    public synchronized Duration nextDelay() {
        return currentDelay;
    }

    public synchronized boolean isBackingOff() {
        return !currentDelay.isZero();
    }

    /**
     * True once the failure budget is spent.
     */
    public synchronized boolean isExhausted() {
        return consecutiveFailures >= maxFailures;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Retries for a transient order submission failure: {@code maxRetries} extra attempts,
     * 200ms doubling up to 2s between them.
     */
    public static BackoffPolicy forOrderSubmission(int maxRetries) {
        return builder()
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(2))
            .multiplier(2.0)
            .maxFailures(maxRetries + 1)
            .toleratedFailures(0)
            .build();
    }

    /**
     * Market data polling: never exhausted, backs off after {@code toleratedFailures}
     * consecutive failures, starting from the polling interval.
     */
    public static BackoffPolicy forMarketData(int toleratedFailures, Duration interval, Duration maxDelay) {
        return builder()
            .initialDelay(interval)
            .maxDelay(maxDelay)
            .multiplier(2.0)
            .maxFailures(Integer.MAX_VALUE)
            .toleratedFailures(toleratedFailures)
            .build();
    }

    public static final class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxFailures = 3;
        private int toleratedFailures = 0;

        private Builder() {}

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
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
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

        public Builder toleratedFailures(int toleratedFailures) {
            if (toleratedFailures < 0) {
                throw new IllegalArgumentException("Tolerated failures cannot be negative");
            }
            this.toleratedFailures = toleratedFailures;
            return this;
        }

        public BackoffPolicy build() {
            return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxFailures, toleratedFailures);
        }
    }
}
