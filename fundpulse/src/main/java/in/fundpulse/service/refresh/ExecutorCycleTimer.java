package in.fundpulse.service.refresh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link CycleTimer} backed by a single daemon scheduler thread.
 */
public final class ExecutorCycleTimer implements CycleTimer {
    private static final Logger log = LoggerFactory.getLogger(ExecutorCycleTimer.class);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "RefreshScheduler");
        t.setDaemon(true);
        return t;
    });

    @Override
    public TimerHandle schedulePeriodic(Runnable task, Duration period) {
        long millis = period.toMillis();
        return new FutureHandle(scheduler.scheduleAtFixedRate(guard(task), millis, millis, TimeUnit.MILLISECONDS));
    }

    @Override
    public TimerHandle scheduleOnce(Runnable task, Duration delay) {
        return new FutureHandle(scheduler.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A periodic task that throws is silently cancelled by the executor, so failures stop here.
     */
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("[CycleTimer] Scheduled task failed: {}", e.getMessage(), e);
            }
        };
    }

    private record FutureHandle(ScheduledFuture<?> future) implements TimerHandle {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
