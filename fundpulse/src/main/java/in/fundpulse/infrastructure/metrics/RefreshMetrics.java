package in.fundpulse.infrastructure.metrics;

import in.fundpulse.domain.error.ErrorKind;

import java.time.Duration;

/**
 * Refresh pipeline metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend.
 *
 * Key metrics:
 * - Refresh cycle success/failure counts and latency
 * - Skipped cycles (market closed, cycle already running)
 * - Retry attempts and terminal failures per error kind
 * - Per-fund valuation source (primary, fallback, unchanged)
 * - Consecutive scheduler failures
 */
public interface RefreshMetrics {

    /**
     * Record a completed refresh cycle.
     *
     * @param success Whether the cycle produced and persisted a result
     * @param latency Wall time of the cycle
     */
    void recordCycle(boolean success, Duration latency);

    /**
     * Record a cycle that was not started.
     *
     * @param reason MARKET_CLOSED or BUSY
     */
    void recordCycleSkipped(String reason);

    /**
     * Record one retry scheduled by the retry executor.
     *
     * @param operation fixed operation name such as "valuation" or "quotes", never per-item text
     */
    void recordRetry(String operation, ErrorKind kind);

    /**
     * Record a failure that was not retried further.
     */
    void recordTerminalFailure(String operation, ErrorKind kind);

    /**
     * Record how many funds got their numbers from a given source in one cycle.
     *
     * @param source primary, fallback or unchanged
     */
    void recordFundValuations(String source, int count);

    void setConsecutiveErrors(int consecutiveErrors);
}
