package in.fundpulse.service.refresh;

import java.time.Duration;

/**
 * Cancellable timer used by the scheduler for its periodic tick and one-shot retries.
 */
public interface CycleTimer {

    /**
     * Run {@code task} every {@code period}, first run one period from now.
     */
    TimerHandle schedulePeriodic(Runnable task, Duration period);

    /**
     * Run {@code task} once after {@code delay}.
     */
    TimerHandle scheduleOnce(Runnable task, Duration delay);

    /**
     * Release timer resources. Pending tasks are dropped.
     */
    void shutdown();

    interface TimerHandle {
        void cancel();

        boolean isCancelled();
    }
}
