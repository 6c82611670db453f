package in.fundpulse.infrastructure.metrics;

import in.fundpulse.domain.error.ErrorKind;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of {@link RefreshMetrics}.
 *
 * Key Metrics:
 * - refresh_cycles_total{result} - cycle success/failure counts
 * - refresh_cycle_duration_seconds - cycle latency distribution
 * - refresh_cycles_skipped_total{reason} - cycles not started
 * - refresh_retries_total{context, kind} - retry attempts
 * - refresh_failures_total{context, kind} - terminal failures
 * - refresh_fund_valuations_total{source} - valuation source per fund
 * - refresh_consecutive_errors - current scheduler failure streak
 */
public class PrometheusRefreshMetrics implements RefreshMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusRefreshMetrics.class);

    private final CollectorRegistry registry;

    private final Counter cycleCounter;
    private final Histogram cycleLatency;
    private final Counter skippedCounter;
    private final Counter retryCounter;
    private final Counter failureCounter;
    private final Counter fundValuationCounter;
    private final Gauge consecutiveErrors;

    public PrometheusRefreshMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRefreshMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.cycleCounter = Counter.build()
            .name("refresh_cycles_total")
            .help("Total number of refresh cycles")
            .labelNames("result")
            .register(registry);

        this.cycleLatency = Histogram.build()
            .name("refresh_cycle_duration_seconds")
            .help("Refresh cycle duration in seconds")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0, 60.0)
            .register(registry);

        this.skippedCounter = Counter.build()
            .name("refresh_cycles_skipped_total")
            .help("Refresh cycles that were not started")
            .labelNames("reason")
            .register(registry);

        this.retryCounter = Counter.build()
            .name("refresh_retries_total")
            .help("Retry attempts scheduled by the retry executor")
            .labelNames("operation", "kind")
            .register(registry);

        this.failureCounter = Counter.build()
            .name("refresh_failures_total")
            .help("Failures that were not retried further")
            .labelNames("operation", "kind")
            .register(registry);

        this.fundValuationCounter = Counter.build()
            .name("refresh_fund_valuations_total")
            .help("Funds valued per source")
            .labelNames("source")
            .register(registry);

        this.consecutiveErrors = Gauge.build()
            .name("refresh_consecutive_errors")
            .help("Current number of consecutive failed refresh cycles")
            .register(registry);

        log.info("[PrometheusRefreshMetrics] Initialized refresh metrics");
    }

    @Override
    public void recordCycle(boolean success, Duration latency) {
        cycleCounter.labels(success ? "success" : "failure").inc();
        cycleLatency.observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordCycleSkipped(String reason) {
        skippedCounter.labels(reason).inc();
    }

    @Override
    public void recordRetry(String operation, ErrorKind kind) {
        retryCounter.labels(operation, label(kind)).inc();
    }

    @Override
    public void recordTerminalFailure(String operation, ErrorKind kind) {
        failureCounter.labels(operation, label(kind)).inc();
    }

    @Override
    public void recordFundValuations(String source, int count) {
        if (count > 0) {
            fundValuationCounter.labels(source).inc(count);
        }
    }

    @Override
    public void setConsecutiveErrors(int value) {
        consecutiveErrors.set(value);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static String label(ErrorKind kind) {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
