package in.fundpulse.config;

import in.fundpulse.infrastructure.resilience.BatchExecutor;
import in.fundpulse.infrastructure.resilience.RetryConfig;
import in.fundpulse.service.market.MarketHoursGate;
import in.fundpulse.service.refresh.RefreshOrchestrator;
import in.fundpulse.service.refresh.SchedulerConfig;
import in.fundpulse.util.Env;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Application settings read from the environment.
 *
 * Keys (environment variable or system property):
 * - FUNDPULSE_PORT                HTTP port (9090)
 * - FUNDPULSE_DATA_FILE           watchlist JSON file (data/watchlist.json)
 * - FUNDPULSE_PROVIDER_URL        base URL of the valuation/quote service
 * - FUNDPULSE_UPDATE_INTERVAL_MS  scheduler tick (60000)
 * - FUNDPULSE_MAX_RETRIES         scheduler consecutive failures before a terminal error (3)
 * - FUNDPULSE_RETRY_DELAY_MS      scheduler auto-retry delay (2000)
 * - FUNDPULSE_FETCH_MAX_RETRIES   per-call retries (3)
 * - FUNDPULSE_FETCH_BASE_DELAY_MS per-call backoff base (1000)
 * - FUNDPULSE_FETCH_MAX_DELAY_MS  per-call backoff cap (10000)
 * - FUNDPULSE_FETCH_CONCURRENCY   in-flight provider calls (5)
 * - FUNDPULSE_QUOTE_BATCH_SIZE    codes per quote request (50)
 * - FUNDPULSE_HTTP_TIMEOUT_MS     provider request timeout (10000)
 * - FUNDPULSE_MARKET_ZONE         exchange time zone (Asia/Shanghai)
 */
public record RefreshConfig(
    int port,
    Path dataFile,
    URI providerUrl,
    SchedulerConfig scheduler,
    RetryConfig retry,
    int fetchConcurrency,
    int quoteBatchSize,
    Duration httpTimeout,
    ZoneId marketZone
) {

    public static RefreshConfig fromEnv() {
        String providerUrl = Env.get("FUNDPULSE_PROVIDER_URL", "http://localhost:8088/");
        if (!providerUrl.endsWith("/")) {
            providerUrl = providerUrl + "/";
        }

        return new RefreshConfig(
            Env.getInt("FUNDPULSE_PORT", 9090),
            Path.of(Env.get("FUNDPULSE_DATA_FILE", "data/watchlist.json")),
            URI.create(providerUrl),
            new SchedulerConfig(
                Env.getMillis("FUNDPULSE_UPDATE_INTERVAL_MS", SchedulerConfig.DEFAULT_UPDATE_INTERVAL),
                Env.getInt("FUNDPULSE_MAX_RETRIES", SchedulerConfig.DEFAULT_MAX_RETRIES),
                Env.getMillis("FUNDPULSE_RETRY_DELAY_MS", SchedulerConfig.DEFAULT_RETRY_DELAY)
            ),
            RetryConfig.builder()
                .maxRetries(Env.getInt("FUNDPULSE_FETCH_MAX_RETRIES", 3))
                .baseDelay(Env.getMillis("FUNDPULSE_FETCH_BASE_DELAY_MS", Duration.ofSeconds(1)))
                .maxDelay(Env.getMillis("FUNDPULSE_FETCH_MAX_DELAY_MS", Duration.ofSeconds(10)))
                .build(),
            Env.getInt("FUNDPULSE_FETCH_CONCURRENCY", BatchExecutor.DEFAULT_CONCURRENCY),
            Env.getInt("FUNDPULSE_QUOTE_BATCH_SIZE", RefreshOrchestrator.DEFAULT_QUOTE_BATCH_SIZE),
            Env.getMillis("FUNDPULSE_HTTP_TIMEOUT_MS", Duration.ofSeconds(10)),
            ZoneId.of(Env.get("FUNDPULSE_MARKET_ZONE", MarketHoursGate.DEFAULT_ZONE.getId()))
        );
    }
}
