package in.fundpulse.service.refresh;

import in.fundpulse.application.port.output.ValuationListener;
import in.fundpulse.domain.fund.Fund;
import in.fundpulse.infrastructure.metrics.RefreshMetrics;
import in.fundpulse.service.market.MarketHoursGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Refresh Scheduler - drives valuation refresh cycles.
 *
 * States: STOPPED, RUNNING.
 * - start(): run one gated cycle now, then one per update interval
 * - stop(): cancel the periodic tick and any pending auto-retry; an in-flight cycle completes
 * - refresh(): one ungated cycle, timer and state untouched
 *
 * Failure handling: every failed cycle increments the consecutive error counter.
 * While running, below maxRetries a one-shot retry is scheduled after retryDelay; the failure
 * that reaches maxRetries emits a single terminal error to the listener and
 * auto-retry stops until a cycle succeeds again. The periodic tick keeps firing.
 *
 * Overlap: ticks and auto-retries are skipped while a cycle is in flight;
 * a manual refresh during a cycle joins that cycle.
 */
public final class RefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final RefreshOrchestrator orchestrator;
    private final MarketHoursGate marketHoursGate;
    private final ValuationListener listener;
    private final CycleTimer timer;
    private final RefreshMetrics metrics;
    private final Clock clock;

    // Guarded by this
    private SchedulerConfig config;
    private boolean running = false;
    private Instant lastUpdateTime;
    private String lastError;
    private int consecutiveErrors = 0;
    private CycleTimer.TimerHandle periodicTask;
    private CycleTimer.TimerHandle retryTask;
    private CompletableFuture<List<Fund>> inFlight;

    public RefreshScheduler(
        RefreshOrchestrator orchestrator,
        MarketHoursGate marketHoursGate,
        ValuationListener listener,
        CycleTimer timer,
        SchedulerConfig config,
        RefreshMetrics metrics,
        Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.marketHoursGate = marketHoursGate;
        this.listener = listener;
        this.timer = timer;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Start automatic refresh. No-op when already running.
     */
    public void start() {
        Duration interval;
        synchronized (this) {
            if (running) {
                log.warn("[Scheduler] Already running");
                return;
            }
            running = true;
            interval = config.updateInterval();
            periodicTask = timer.schedulePeriodic(this::runScheduledCycle, interval);
        }

        log.info("[Scheduler] Starting valuation update scheduler, interval: {}ms", interval.toMillis());
        runScheduledCycle();
    }

    /**
     * Stop automatic refresh. Idempotent.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            cancelTimers();
        }
        log.info("[Scheduler] Stopping valuation update scheduler");
    }

    /**
     * Trigger one refresh now, ignoring market hours.
     *
     * @return the cycle result; completes exceptionally when the cycle fails
     */
    public CompletableFuture<List<Fund>> refresh() {
        log.info("[Scheduler] Manual valuation refresh triggered");
        return startCycle();
    }

    /**
     * Replace the configuration, restarting the timer when running.
     */
    public void updateConfig(SchedulerConfig newConfig) {
        boolean wasRunning;
        synchronized (this) {
            wasRunning = running;
        }
        if (wasRunning) {
            stop();
        }
        synchronized (this) {
            config = newConfig;
        }
        log.info("[Scheduler] Configuration updated: {}", newConfig);
        if (wasRunning) {
            start();
        }
    }

    public synchronized SchedulerStatus getStatus() {
        return new SchedulerStatus(running, lastUpdateTime, lastError, consecutiveErrors);
    }

    public synchronized SchedulerConfig getConfig() {
        return config;
    }

    /**
     * Periodic tick or auto-retry: gated by market hours, skipped while busy.
     */
    private void runScheduledCycle() {
        if (!marketHoursGate.isOpen()) {
            log.debug("[Scheduler] Market closed, skipping refresh");
            if (metrics != null) {
                metrics.recordCycleSkipped("MARKET_CLOSED");
            }
            return;
        }

        synchronized (this) {
            if (inFlight != null) {
                log.info("[Scheduler] Previous refresh still running, skipping tick");
                if (metrics != null) {
                    metrics.recordCycleSkipped("BUSY");
                }
                return;
            }
        }

        startCycle();
    }

    private CompletableFuture<List<Fund>> startCycle() {
        CompletableFuture<List<Fund>> cycle;
        synchronized (this) {
            if (inFlight != null) {
                return inFlight;
            }
            cycle = new CompletableFuture<>();
            inFlight = cycle;
        }

        Instant startedAt = clock.instant();
        CompletableFuture<List<Fund>> work;
        try {
            work = orchestrator.refreshAll();
        } catch (RuntimeException e) {
            work = CompletableFuture.failedFuture(e);
        }

        work.whenComplete((funds, error) -> {
            synchronized (this) {
                inFlight = null;
            }
            Duration latency = Duration.between(startedAt, clock.instant());

            if (error == null) {
                onCycleSuccess(funds, latency);
                cycle.complete(funds);
            } else {
                Throwable cause = unwrap(error);
                onCycleFailure(cause, latency);
                cycle.completeExceptionally(cause);
            }
        });

        return cycle;
    }

    private void onCycleSuccess(List<Fund> funds, Duration latency) {
        synchronized (this) {
            lastUpdateTime = clock.instant();
            lastError = null;
            consecutiveErrors = 0;
        }

        if (metrics != null) {
            metrics.recordCycle(true, latency);
            metrics.setConsecutiveErrors(0);
        }

        log.info("[Scheduler] Valuation update successful, updated {} funds in {}ms", funds.size(), latency.toMillis());
        notifyUpdated(funds);
    }

    private void onCycleFailure(Throwable error, Duration latency) {
        String message = error.getMessage() != null ? error.getMessage() : "Unknown error";
        int errors;
        int maxRetries;
        Duration retryDelay;
        boolean retryScheduled = false;

        synchronized (this) {
            lastError = message;
            consecutiveErrors++;
            errors = consecutiveErrors;
            maxRetries = config.maxRetries();
            retryDelay = config.retryDelay();

            // a stopped scheduler never arms timers, whichever cycle failed
            if (running && errors < maxRetries) {
                if (retryTask != null) {
                    retryTask.cancel();
                }
                retryTask = timer.scheduleOnce(this::runRetry, retryDelay);
                retryScheduled = true;
            }
        }

        if (metrics != null) {
            metrics.recordCycle(false, latency);
            metrics.setConsecutiveErrors(errors);
        }

        log.error("[Scheduler] Valuation update failed ({}/{}): {}", errors, maxRetries, message);

        if (retryScheduled) {
            log.info("[Scheduler] Will retry in {}ms", retryDelay.toMillis());
        }
        if (errors == maxRetries) {
            notifyError("Network connection error, check network and retry (" + message + ")");
        }
    }

    private void runRetry() {
        synchronized (this) {
            retryTask = null;
            if (!running) {
                return;
            }
        }
        runScheduledCycle();
    }

    private void cancelTimers() {
        if (periodicTask != null) {
            periodicTask.cancel();
            periodicTask = null;
        }
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    private void notifyUpdated(List<Fund> funds) {
        try {
            listener.onValuationUpdated(funds);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Valuation listener failed: {}", e.getMessage(), e);
        }
    }

    private void notifyError(String message) {
        try {
            listener.onError(message);
        } catch (RuntimeException e) {
            log.warn("[Scheduler] Error listener failed: {}", e.getMessage(), e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
