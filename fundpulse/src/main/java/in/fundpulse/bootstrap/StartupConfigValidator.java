package in.fundpulse.bootstrap;

import in.fundpulse.config.RefreshConfig;
import in.fundpulse.infrastructure.resilience.RetryConfig;
import in.fundpulse.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException listing every
 * problem when the configuration is unusable, and the process refuses to start.
 *
 * Raw values are checked before {@link RefreshConfig#fromEnv()} runs, since the
 * scheduler and retry settings reject bad values in their constructors.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * Check the raw settings, build the configuration and validate it.
     */
    public static RefreshConfig load() {
        List<String> problems = checkEnvironment();
        if (!problems.isEmpty()) {
            throw invalid(problems);
        }
        RefreshConfig config = RefreshConfig.fromEnv();
        validate(config);
        return config;
    }

    static List<String> checkEnvironment() {
        List<String> problems = new ArrayList<>();

        readInt("FUNDPULSE_PORT", problems);
        readInt("FUNDPULSE_FETCH_CONCURRENCY", problems);
        readInt("FUNDPULSE_QUOTE_BATCH_SIZE", problems);
        readLong("FUNDPULSE_HTTP_TIMEOUT_MS", problems);

        Long interval = readLong("FUNDPULSE_UPDATE_INTERVAL_MS", problems);
        if (interval != null && interval <= 0) {
            problems.add("FUNDPULSE_UPDATE_INTERVAL_MS must be positive, got " + interval);
        }
        Integer maxRetries = readInt("FUNDPULSE_MAX_RETRIES", problems);
        if (maxRetries != null && maxRetries < 1) {
            problems.add("FUNDPULSE_MAX_RETRIES must be at least 1, got " + maxRetries);
        }
        Long retryDelay = readLong("FUNDPULSE_RETRY_DELAY_MS", problems);
        if (retryDelay != null && retryDelay < 0) {
            problems.add("FUNDPULSE_RETRY_DELAY_MS cannot be negative, got " + retryDelay);
        }

        Integer fetchRetries = readInt("FUNDPULSE_FETCH_MAX_RETRIES", problems);
        if (fetchRetries != null && fetchRetries < 0) {
            problems.add("FUNDPULSE_FETCH_MAX_RETRIES cannot be negative, got " + fetchRetries);
        }
        RetryConfig defaults = RetryConfig.defaults();
        Long baseDelay = readLong("FUNDPULSE_FETCH_BASE_DELAY_MS", problems);
        Long maxDelay = readLong("FUNDPULSE_FETCH_MAX_DELAY_MS", problems);
        long base = baseDelay != null ? baseDelay : defaults.baseDelay().toMillis();
        long max = maxDelay != null ? maxDelay : defaults.maxDelay().toMillis();
        if (base < 0) {
            problems.add("FUNDPULSE_FETCH_BASE_DELAY_MS cannot be negative, got " + base);
        } else if (max < base) {
            problems.add("FUNDPULSE_FETCH_MAX_DELAY_MS (" + max + ") cannot be less than FUNDPULSE_FETCH_BASE_DELAY_MS (" + base + ")");
        }

        String zone = Env.get("FUNDPULSE_MARKET_ZONE", null);
        if (zone != null) {
            try {
                ZoneId.of(zone);
            } catch (DateTimeException e) {
                problems.add("FUNDPULSE_MARKET_ZONE is not a known time zone: '" + zone + "'");
            }
        }
        String providerUrl = Env.get("FUNDPULSE_PROVIDER_URL", null);
        if (providerUrl != null) {
            try {
                URI.create(providerUrl);
            } catch (IllegalArgumentException e) {
                problems.add("FUNDPULSE_PROVIDER_URL is not a valid URL: '" + providerUrl + "'");
            }
        }

        return problems;
    }

    public static void validate(RefreshConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");

        List<String> problems = new ArrayList<>();

        if (config.port() < 1 || config.port() > 65535) {
            problems.add("FUNDPULSE_PORT must be between 1 and 65535, got " + config.port());
        }
        if (config.fetchConcurrency() < 1) {
            problems.add("FUNDPULSE_FETCH_CONCURRENCY must be at least 1, got " + config.fetchConcurrency());
        }
        if (config.quoteBatchSize() < 1) {
            problems.add("FUNDPULSE_QUOTE_BATCH_SIZE must be at least 1, got " + config.quoteBatchSize());
        }
        if (config.httpTimeout().isNegative() || config.httpTimeout().isZero()) {
            problems.add("FUNDPULSE_HTTP_TIMEOUT_MS must be positive");
        }
        String scheme = config.providerUrl().getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            problems.add("FUNDPULSE_PROVIDER_URL must be an http(s) URL, got " + config.providerUrl());
        }

        if (!problems.isEmpty()) {
            throw invalid(problems);
        }

        log.info("✓ Data file: {}", config.dataFile().toAbsolutePath());
        log.info("✓ Provider: {}", config.providerUrl());
        log.info("✓ Scheduler: every {}s, {} retries, retry delay {}ms",
            config.scheduler().updateInterval().toSeconds(),
            config.scheduler().maxRetries(),
            config.scheduler().retryDelay().toMillis());
        log.info("✓ Market zone: {}", config.marketZone());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static IllegalStateException invalid(List<String> problems) {
        return new IllegalStateException("Invalid configuration:\n  - " + String.join("\n  - ", problems));
    }

    private static Integer readInt(String key, List<String> problems) {
        String value = Env.get(key, null);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            problems.add(key + " must be an integer, got '" + value + "'");
            return null;
        }
    }

    private static Long readLong(String key, List<String> problems) {
        String value = Env.get(key, null);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            problems.add(key + " must be a number of milliseconds, got '" + value + "'");
            return null;
        }
    }

    private StartupConfigValidator() {}
}
