package in.fundpulse.infrastructure.resilience;

import in.fundpulse.domain.error.ErrorState;
import in.fundpulse.domain.error.FetchException;
import in.fundpulse.infrastructure.metrics.RefreshMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs asynchronous operations with classification-aware retry and exponential backoff.
 *
 * Behaviour per failure:
 * - non-retryable kind: recorded and returned at once, no delay
 * - retryable kind with retries left: wait {@link RetryConfig#delayForRetry(int)}, try again
 * - retryable kind, retries exhausted: recorded and returned as a wrapped error
 *
 * Waiting never parks the calling thread; the next attempt is chained on the
 * {@link DelayScheduler}'s future.
 *
 * Usage:
 * <pre>
 * RetryExecutor retry = new RetryExecutor(RetryConfig.defaults(), metrics);
 *
 * retry.execute(() -> provider.getValuation(code), "valuation", code)
 *     .thenAccept(result -> {
 *         if (result.isSuccess()) { ... } else { log.warn(result.error().getMessage()); }
 *     });
 * </pre>
 */
public final class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final ErrorClassifier classifier;
    private final DelayScheduler delayScheduler;
    private final ErrorHistory errorHistory;
    private final RefreshMetrics metrics;
    private final Clock clock;

    public RetryExecutor(RetryConfig config, RefreshMetrics metrics) {
        this(config, new ErrorClassifier(), DelayScheduler.async(), new ErrorHistory(), metrics, Clock.systemUTC());
    }

    public RetryExecutor(
        RetryConfig config,
        ErrorClassifier classifier,
        DelayScheduler delayScheduler,
        ErrorHistory errorHistory,
        RefreshMetrics metrics,
        Clock clock
    ) {
        this.config = config;
        this.classifier = classifier;
        this.delayScheduler = delayScheduler;
        this.errorHistory = errorHistory;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run the operation, retrying retryable failures.
     * The returned future always completes normally; failures are carried in the result.
     *
     * @param operation supplies a fresh attempt each time it is called
     * @param name      fixed operation name, used as the metrics label
     */
    public <T> CompletableFuture<RetryResult<T>> execute(Supplier<CompletableFuture<T>> operation, String name) {
        return execute(operation, name, null);
    }

    /**
     * @param target what the call is about (a fund code, a page size), logged but kept out of metrics
     */
    public <T> CompletableFuture<RetryResult<T>> execute(
        Supplier<CompletableFuture<T>> operation,
        String name,
        String target
    ) {
        CompletableFuture<RetryResult<T>> result = new CompletableFuture<>();
        String context = target == null ? name : name + " " + target;
        attempt(operation, name, context, 0, result);
        return result;
    }

    /**
     * Same as {@link #execute} but completes exceptionally with the terminal {@link FetchException}.
     */
    public <T> CompletableFuture<T> withRetry(Supplier<CompletableFuture<T>> operation, String name) {
        return execute(operation, name).thenCompose(result -> result.isSuccess()
            ? CompletableFuture.completedFuture(result.value())
            : CompletableFuture.failedFuture(result.error()));
    }

    private <T> void attempt(
        Supplier<CompletableFuture<T>> operation,
        String name,
        String context,
        int retriesMade,
        CompletableFuture<RetryResult<T>> result
    ) {
        CompletableFuture<T> call;
        try {
            call = operation.get();
            if (call == null) {
                call = CompletableFuture.failedFuture(new IllegalStateException(context + " returned no result"));
            }
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        call.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(RetryResult.success(value, retriesMade + 1));
                return;
            }

            FetchException classified = classifier.classify(error);

            if (!classified.isRetryable()) {
                recordTerminal(name, context, classified, retriesMade);
                result.complete(RetryResult.failure(classified, retriesMade + 1));
                return;
            }

            int retry = retriesMade + 1;
            if (retry > config.maxRetries()) {
                recordTerminal(name, context, classified, retriesMade);
                FetchException exhausted = new FetchException(
                    classified.getKind(),
                    false,
                    String.format("%s failed after %d retries: %s", context, config.maxRetries(), classified.getMessage()),
                    classified
                );
                result.complete(RetryResult.failure(exhausted, retry));
                return;
            }

            Duration delay = config.delayForRetry(retry);
            log.warn("[Retry] {} failed, retrying ({}/{}) in {}ms: {}",
                context, retry, config.maxRetries(), delay.toMillis(), classified.getMessage());
            if (metrics != null) {
                metrics.recordRetry(name, classified.getKind());
            }

            delayScheduler.delay(delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    log.warn("[Retry] Backoff wait for {} interrupted: {}", context, delayError.getMessage());
                }
                attempt(operation, name, context, retry, result);
            });
        });
    }

    private void recordTerminal(String name, String context, FetchException error, int retryCount) {
        ErrorState state = error.toErrorState(clock.instant(), retryCount);
        errorHistory.record(state);

        log.error("[Retry] [{}] {} failed: {} (retries: {})",
            error.getKind(), context, error.getMessage(), retryCount);

        if (metrics != null) {
            metrics.recordTerminalFailure(name, error.getKind());
        }
    }

    public RetryConfig getConfig() {
        return config;
    }

    public List<ErrorState> getErrorHistory() {
        return errorHistory.snapshot();
    }

    public Optional<ErrorState> getLastError() {
        return errorHistory.last();
    }

    public void clearErrorHistory() {
        errorHistory.clear();
    }
}
