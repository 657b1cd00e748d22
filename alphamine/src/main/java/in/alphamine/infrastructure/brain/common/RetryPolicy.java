package in.alphamine.infrastructure.brain.common;

import in.alphamine.config.BrainClientConfig;

import java.time.Duration;

/**
 * Retry budget with exponential backoff for calls to the platform.
 *
 * Backoff before retry {@code n} (zero-based) is {@code baseDelay * 2^n}, capped at
 * {@code maxDelay}. Server-directed waits (429 Retry-After) do not consume
 * {@code maxAttempts}; they are bounded separately by {@code maxRateLimitWaits}.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(5))
 *     .maxAttempts(3)
 *     .build();
 *
 * for (int attempt = 0; attempt &lt; policy.maxAttempts(); attempt++) {
 *     ...
 *     sleeper.sleep(policy.delayForAttempt(attempt));
 * }
 * </pre>
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final int maxRateLimitWaits;

    private RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, int maxRateLimitWaits) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.maxRateLimitWaits = maxRateLimitWaits;
    }

    /**
     * Backoff to apply after the given failed attempt.
     *
     * @param attempt zero-based index of the attempt that just failed
     * @return baseDelay * 2^attempt, never more than maxDelay
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative: " + attempt);
        }
        long base = baseDelay.toMillis();
        // 2^62 already overflows any realistic cap
        int shift = Math.min(attempt, 62);
        long multiplier = 1L << shift;
        long millis = base > Long.MAX_VALUE / multiplier ? Long.MAX_VALUE : base * multiplier;
        return Duration.ofMillis(Math.min(millis, maxDelay.toMillis()));
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public int maxRateLimitWaits() {
        return maxRateLimitWaits;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy derived from client configuration (WQ_MAX_RETRIES, WQ_RETRY_DELAY).
     */
    public static RetryPolicy fromConfig(BrainClientConfig config) {
        return builder()
            .baseDelay(config.retryDelay())
            .maxAttempts(config.maxRetries())
            .build();
    }

    /**
     * Defaults: 3 attempts, 5 second base delay.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return "RetryPolicy[baseDelay=" + baseDelay + ", maxDelay=" + maxDelay
            + ", maxAttempts=" + maxAttempts + ", maxRateLimitWaits=" + maxRateLimitWaits + "]";
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(5);
        private Duration maxDelay = Duration.ofMinutes(5);
        private int maxAttempts = 3;
        private int maxRateLimitWaits = 30;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay == null || baseDelay.isNegative()) {
                throw new IllegalArgumentException("Base delay must not be negative");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay == null || maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder maxRateLimitWaits(int maxRateLimitWaits) {
            if (maxRateLimitWaits < 0) {
                throw new IllegalArgumentException("Max rate limit waits must not be negative");
            }
            this.maxRateLimitWaits = maxRateLimitWaits;
            return this;
        }

        public RetryPolicy build() {
            if (baseDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Base delay cannot exceed max delay");
            }
            return new RetryPolicy(baseDelay, maxDelay, maxAttempts, maxRateLimitWaits);
        }
    }
}
