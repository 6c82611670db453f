package in.fundpulse.infrastructure.resilience;

import java.time.Duration;

/**
 * Immutable retry settings with exponential backoff.
 *
 * Usage:
 * <pre>
 * RetryConfig config = RetryConfig.builder()
 *     .maxRetries(5)
 *     .baseDelay(Duration.ofMillis(500))
 *     .build();
 * </pre>
 * Unset fields keep the defaults: 3 retries, 1s base delay, 10s cap, multiplier 2.
 */
public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    double backoffMultiplier
) {
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay cannot be negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay cannot be less than base delay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0");
        }
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    /**
     * Delay before the given retry, 1-based: base * multiplier^(retry-1), capped at maxDelay.
     */
    public Duration delayForRetry(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = baseDelay.toMillis() * Math.pow(backoffMultiplier, retry - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double backoffMultiplier = 2.0;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(maxRetries, baseDelay, maxDelay, backoffMultiplier);
        }
    }
}
