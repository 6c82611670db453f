package in.fundpulse.service.refresh;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler.
 */
public record SchedulerStatus(
    boolean running,
    Instant lastUpdateTime,
    String lastError,
    int consecutiveErrors
) {}
