package in.fundpulse.service.refresh;

import java.time.Duration;

/**
 * Scheduler timing.
 *
 * @param updateInterval period of the automatic refresh tick
 * @param maxRetries     consecutive failures before auto-retry stops and a terminal error is emitted
 * @param retryDelay     wait before an automatic retry of a failed cycle
 */
public record SchedulerConfig(Duration updateInterval, int maxRetries, Duration retryDelay) {

    public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);

    public SchedulerConfig {
        if (updateInterval == null || updateInterval.isNegative() || updateInterval.isZero()) {
            throw new IllegalArgumentException("Update interval must be positive");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("Max retries must be at least 1");
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delay cannot be negative");
        }
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(DEFAULT_UPDATE_INTERVAL, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    public SchedulerConfig withUpdateInterval(Duration interval) {
        return new SchedulerConfig(interval, maxRetries, retryDelay);
    }

    public SchedulerConfig withMaxRetries(int retries) {
        return new SchedulerConfig(updateInterval, retries, retryDelay);
    }
}
