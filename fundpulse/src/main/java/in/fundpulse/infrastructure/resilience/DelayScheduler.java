package in.fundpulse.infrastructure.resilience;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Non-blocking wait used between retry attempts.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * @return a future completing once the delay has elapsed
     */
    CompletableFuture<Void> delay(Duration duration);

    /**
     * Delays on the common pool's delayed executor; no thread is parked while waiting.
     */
    static DelayScheduler async() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));
        };
    }
}
