package in.fundpulse.infrastructure.provider;

import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.FetchException;
import in.fundpulse.domain.market.Quote;
import in.fundpulse.domain.valuation.FundValuation;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP providers against a stub server.
 */
class HttpProviderTest {

    private static final int TEST_PORT = 19192;
    private static final URI BASE = URI.create("http://localhost:" + TEST_PORT + "/");
    private static final Instant NOW = Instant.parse("2024-03-04T02:00:00Z");

    private Undertow server;
    private volatile String lastCodes;

    private HttpValuationProvider valuations;
    private HttpQuoteProvider quotes;

    @BeforeEach
    void setUp() {
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/valuations/161725", exchange -> json(exchange, 200,
                    "{\"fundCode\":\"161725\",\"netValue\":1.2345,\"netValueDate\":\"2024-03-01\","
                        + "\"estimatedValue\":1.2401,\"estimatedChange\":0.45,"
                        + "\"updateTime\":\"2024-03-04T01:30:00Z\",\"realValue\":false,\"tradingSession\":true}"))
                .get("/valuations/000002", exchange -> json(exchange, 200,
                    "{\"estimatedValue\":\"n/a\"}"))
                .get("/valuations/000003", exchange -> json(exchange, 503, "{}"))
                .get("/valuations/000004", exchange -> json(exchange, 200, "<html>oops"))
                .get("/valuations/000005", exchange -> json(exchange, 403, "{}"))
                .get("/quotes", exchange -> {
                    Deque<String> codes = exchange.getQueryParameters().get("codes");
                    lastCodes = codes == null ? null : codes.getFirst();
                    json(exchange, 200,
                        "[{\"code\":\"600519\",\"name\":\"Kweichow Moutai\",\"price\":1688.0,\"change\":1.25,\"changeAmount\":20.84},"
                            + "{\"name\":\"no code\"},"
                            + "{\"code\":\"000858\",\"name\":\"Wuliangye\",\"price\":150.2,\"change\":-0.3}]");
                })
                .setFallbackHandler(exchange -> json(exchange, 404, "{}")))
            .build();
        server.start();

        valuations = new HttpValuationProvider(BASE, Duration.ofSeconds(5), Clock.fixed(NOW, ZoneOffset.UTC));
        quotes = new HttpQuoteProvider(BASE, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private static void json(HttpServerExchange exchange, int status, String body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(body);
    }

    @Test
    void testValuationParsed() {
        FundValuation valuation = valuations.getValuation("161725").join().orElseThrow();

        assertEquals("161725", valuation.fundCode());
        assertEquals(1.2345, valuation.netValue(), 1e-9);
        assertEquals(LocalDate.of(2024, 3, 1), valuation.netValueDate());
        assertEquals(1.2401, valuation.estimatedValue(), 1e-9);
        assertEquals(0.45, valuation.estimatedChange(), 1e-9);
        assertEquals(Instant.parse("2024-03-04T01:30:00Z"), valuation.updateTime());
        assertFalse(valuation.realValue());
        assertTrue(valuation.tradingSession());
    }

    @Test
    void testMissingFieldsAreNormalised() {
        FundValuation valuation = valuations.getValuation("000002").join().orElseThrow();

        assertEquals("000002", valuation.fundCode());
        assertEquals(0.0, valuation.estimatedValue());
        assertNull(valuation.netValueDate());
        assertEquals(NOW, valuation.updateTime());
        assertFalse(valuation.tradingSession());
    }

    @Test
    void testNotFoundIsEmpty() {
        Optional<FundValuation> valuation = valuations.getValuation("999999").join();

        assertTrue(valuation.isEmpty());
    }

    @Test
    void testServerErrorIsRetryableNetworkFailure() {
        FetchException error = failure(() -> valuations.getValuation("000003").join());

        assertEquals(ErrorKind.NETWORK, error.getKind());
        assertTrue(error.isRetryable());
    }

    @Test
    void testMalformedBodyIsParseFailure() {
        FetchException error = failure(() -> valuations.getValuation("000004").join());

        assertEquals(ErrorKind.PARSE, error.getKind());
        assertFalse(error.isRetryable());
    }

    @Test
    void testUnexpectedStatusIsUnknownFailure() {
        FetchException error = failure(() -> valuations.getValuation("000005").join());

        assertEquals(ErrorKind.UNKNOWN, error.getKind());
    }

    @Test
    void testQuotesParsedAndEntriesWithoutCodeDropped() {
        Set<String> codes = new LinkedHashSet<>(List.of("600519", "000858"));

        List<Quote> result = quotes.getQuotes(codes).join();

        assertEquals("600519,000858", lastCodes);
        assertEquals(2, result.size());
        assertEquals(new Quote("600519", "Kweichow Moutai", 1688.0, 1.25, 20.84), result.get(0));
        assertEquals(0.0, result.get(1).changeAmount());
    }

    @Test
    void testEmptyCodeSetSkipsRequest() {
        assertTrue(quotes.getQuotes(Set.of()).join().isEmpty());
        assertNull(lastCodes);
    }

    private static FetchException failure(Runnable call) {
        CompletionException thrown = assertThrows(CompletionException.class, call::run);
        return assertInstanceOf(FetchException.class, thrown.getCause());
    }
}
