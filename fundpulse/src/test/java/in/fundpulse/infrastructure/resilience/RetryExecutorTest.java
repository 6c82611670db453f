package in.fundpulse.infrastructure.resilience;

import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.ErrorState;
import in.fundpulse.domain.error.FetchException;
import in.fundpulse.infrastructure.metrics.RefreshMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RetryExecutorTest {

    private final List<Duration> delays = new ArrayList<>();
    private final DelayScheduler recordingDelays = duration -> {
        delays.add(duration);
        return CompletableFuture.completedFuture(null);
    };
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-04T02:00:00Z"), ZoneOffset.UTC);

    private RefreshMetrics metrics;
    private ErrorHistory history;

    @BeforeEach
    void setUp() {
        metrics = mock(RefreshMetrics.class);
        history = new ErrorHistory();
    }

    private RetryExecutor executor(RetryConfig config) {
        return new RetryExecutor(config, new ErrorClassifier(), recordingDelays, history, metrics, clock);
    }

    private static CompletableFuture<String> failing(Throwable error) {
        return CompletableFuture.failedFuture(error);
    }

    @Test
    void testSuccessOnFirstAttempt() {
        RetryResult<String> result = executor(RetryConfig.defaults())
            .<String>execute(() -> CompletableFuture.completedFuture("ok"), "valuation", "000001")
            .join();

        assertTrue(result.isSuccess());
        assertEquals("ok", result.value());
        assertEquals(1, result.attempts());
        assertTrue(delays.isEmpty());
        assertTrue(history.snapshot().isEmpty());
    }

    @Test
    void testRetryableFailureThenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor(RetryConfig.defaults())
            .<String>execute(() -> calls.incrementAndGet() < 3
                ? failing(new IOException("socket reset"))
                : CompletableFuture.completedFuture("ok"), "quotes")
            .join();

        assertTrue(result.isSuccess());
        assertEquals(3, result.attempts());
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000)), delays);
        verify(metrics, times(2)).recordRetry(eq("quotes"), eq(ErrorKind.NETWORK));
        assertTrue(history.snapshot().isEmpty(), "Recovered failures are not recorded");
    }

    @Test
    void testExhaustedRetriesFollowBackoffSchedule() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor(RetryConfig.builder().maxRetries(5).build())
            .<String>execute(() -> {
                calls.incrementAndGet();
                return failing(new IOException("request timed out"));
            }, "valuation", "000001")
            .join();

        assertFalse(result.isSuccess());
        assertEquals(6, calls.get(), "One initial attempt plus five retries");
        assertEquals(6, result.attempts());
        assertEquals(List.of(
            Duration.ofMillis(1000),
            Duration.ofMillis(2000),
            Duration.ofMillis(4000),
            Duration.ofMillis(8000),
            Duration.ofMillis(10000)
        ), delays);

        FetchException error = result.error();
        assertEquals(ErrorKind.NETWORK, error.getKind());
        assertFalse(error.isRetryable());
        assertEquals(
            "valuation 000001 failed after 5 retries: Network connection timed out, check your network",
            error.getMessage());

        ErrorState last = history.last().orElseThrow();
        assertEquals(ErrorKind.NETWORK, last.kind());
        assertEquals(5, last.retryCount());
        assertEquals(clock.instant(), last.timestamp());
        verify(metrics).recordTerminalFailure("valuation", ErrorKind.NETWORK);
        verify(metrics, times(5)).recordRetry("valuation", ErrorKind.NETWORK);
        verify(metrics, never()).recordRetry(eq("valuation 000001"), any());
    }

    @Test
    void testNonRetryableFailureStopsImmediately() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor(RetryConfig.defaults())
            .<String>execute(() -> {
                calls.incrementAndGet();
                return failing(new FetchException(ErrorKind.PARSE, "Failed to parse data"));
            }, "quotes")
            .join();

        assertFalse(result.isSuccess());
        assertEquals(1, calls.get());
        assertEquals(1, result.attempts());
        assertTrue(delays.isEmpty(), "No backoff for non-retryable failures");
        assertEquals(ErrorKind.PARSE, result.error().getKind());
        assertEquals(0, history.last().orElseThrow().retryCount());
        verify(metrics, never()).recordRetry(anyString(), any());
    }

    @Test
    void testZeroRetriesMeansSingleAttempt() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = executor(RetryConfig.builder().maxRetries(0).build())
            .<String>execute(() -> {
                calls.incrementAndGet();
                return failing(new IOException("connection refused"));
            }, "quotes")
            .join();

        assertFalse(result.isSuccess());
        assertEquals(1, calls.get());
        assertTrue(delays.isEmpty());
    }

    @Test
    void testSupplierThrowingIsTreatedAsFailure() {
        RetryResult<String> result = executor(RetryConfig.defaults())
            .<String>execute(() -> {
                throw new IllegalStateException("boom");
            }, "quotes")
            .join();

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.UNKNOWN, result.error().getKind());
        assertEquals("boom", result.error().getMessage());
    }

    @Test
    void testWithRetryFailsWithTerminalError() {
        CompletableFuture<String> future = executor(RetryConfig.builder().maxRetries(0).build())
            .withRetry(() -> failing(new IllegalArgumentException("Fund 000009 not found")), "valuation");

        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        FetchException cause = assertInstanceOf(FetchException.class, thrown.getCause());
        assertEquals(ErrorKind.NOT_FOUND, cause.getKind());
    }

    @Test
    void testErrorHistoryKeepsMostRecentHundred() {
        RetryExecutor executor = executor(RetryConfig.builder().maxRetries(0).build());

        for (int i = 0; i < 105; i++) {
            String message = "failure " + i;
            executor.execute(() -> failing(new IllegalArgumentException(message)), "op").join();
        }

        List<ErrorState> entries = executor.getErrorHistory();
        assertEquals(ErrorHistory.DEFAULT_CAPACITY, entries.size());
        assertEquals("failure 5", entries.get(0).message());
        assertEquals("failure 104", executor.getLastError().orElseThrow().message());

        executor.clearErrorHistory();
        assertTrue(executor.getErrorHistory().isEmpty());
        assertTrue(executor.getLastError().isEmpty());
    }
}
