package in.fundpulse.bootstrap;

import in.fundpulse.config.RefreshConfig;
import in.fundpulse.infrastructure.resilience.RetryConfig;
import in.fundpulse.service.market.MarketHoursGate;
import in.fundpulse.service.refresh.SchedulerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupConfigValidatorTest {

    private static final List<String> KEYS = List.of(
        "FUNDPULSE_MAX_RETRIES",
        "FUNDPULSE_UPDATE_INTERVAL_MS",
        "FUNDPULSE_RETRY_DELAY_MS",
        "FUNDPULSE_FETCH_MAX_RETRIES",
        "FUNDPULSE_FETCH_BASE_DELAY_MS",
        "FUNDPULSE_FETCH_MAX_DELAY_MS",
        "FUNDPULSE_MARKET_ZONE",
        "FUNDPULSE_PORT"
    );

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    private static RefreshConfig config(int port, String providerUrl, int concurrency, Duration timeout) {
        return new RefreshConfig(
            port,
            Path.of("data/watchlist.json"),
            URI.create(providerUrl),
            SchedulerConfig.defaults(),
            RetryConfig.defaults(),
            concurrency,
            50,
            timeout,
            MarketHoursGate.DEFAULT_ZONE
        );
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            config(9090, "http://localhost:8088/", 5, Duration.ofSeconds(10))));
    }

    @Test
    void testAllProblemsAreReported() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(config(70000, "ftp://example.com/", 0, Duration.ZERO)));

        String message = thrown.getMessage();
        assertTrue(message.contains("FUNDPULSE_PORT"), message);
        assertTrue(message.contains("FUNDPULSE_FETCH_CONCURRENCY"), message);
        assertTrue(message.contains("FUNDPULSE_HTTP_TIMEOUT_MS"), message);
        assertTrue(message.contains("FUNDPULSE_PROVIDER_URL"), message);
    }

    @Test
    void testOutOfRangeSchedulerAndRetryValuesAreReportedTogether() {
        System.setProperty("FUNDPULSE_MAX_RETRIES", "0");
        System.setProperty("FUNDPULSE_UPDATE_INTERVAL_MS", "0");
        System.setProperty("FUNDPULSE_RETRY_DELAY_MS", "-1");
        System.setProperty("FUNDPULSE_FETCH_MAX_RETRIES", "-2");
        System.setProperty("FUNDPULSE_FETCH_BASE_DELAY_MS", "5000");
        System.setProperty("FUNDPULSE_FETCH_MAX_DELAY_MS", "1000");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, StartupConfigValidator::load);

        String message = thrown.getMessage();
        assertTrue(message.startsWith("Invalid configuration"), message);
        assertTrue(message.contains("FUNDPULSE_MAX_RETRIES must be at least 1, got 0"), message);
        assertTrue(message.contains("FUNDPULSE_UPDATE_INTERVAL_MS must be positive"), message);
        assertTrue(message.contains("FUNDPULSE_RETRY_DELAY_MS cannot be negative"), message);
        assertTrue(message.contains("FUNDPULSE_FETCH_MAX_RETRIES cannot be negative"), message);
        assertTrue(message.contains("FUNDPULSE_FETCH_MAX_DELAY_MS (1000) cannot be less than"), message);
    }

    @Test
    void testMalformedValuesAreReportedTogether() {
        System.setProperty("FUNDPULSE_PORT", "http");
        System.setProperty("FUNDPULSE_MAX_RETRIES", "three");
        System.setProperty("FUNDPULSE_MARKET_ZONE", "Mars/Olympus");

        List<String> problems = StartupConfigValidator.checkEnvironment();

        assertEquals(3, problems.size(), problems.toString());
        assertTrue(problems.get(0).contains("FUNDPULSE_PORT must be an integer"));
        assertTrue(problems.get(1).contains("FUNDPULSE_MAX_RETRIES must be an integer"));
        assertTrue(problems.get(2).contains("FUNDPULSE_MARKET_ZONE"));
    }

    @Test
    void testLoadWithDefaultsBuildsConfig() {
        RefreshConfig config = StartupConfigValidator.load();

        assertEquals(3, config.scheduler().maxRetries());
        assertEquals(9090, config.port());
    }
}
