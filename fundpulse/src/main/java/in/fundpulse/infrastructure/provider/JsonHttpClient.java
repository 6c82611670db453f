package in.fundpulse.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous JSON GET with status mapping shared by the HTTP providers.
 *
 * Status mapping:
 * - 200: body parsed as JSON
 * - 404: empty result
 * - 5xx and 429: NETWORK failure (retryable)
 * - other: UNKNOWN failure
 * - unreadable body: PARSE failure
 */
final class JsonHttpClient {
    private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private final Duration timeout;

    JsonHttpClient(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    JsonHttpClient(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    CompletableFuture<Optional<JsonNode>> get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> toJson(uri, response));
    }

    private Optional<JsonNode> toJson(URI uri, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 404) {
            log.debug("[JsonHttpClient] {} returned 404", uri);
            return Optional.empty();
        }
        if (status >= 500 || status == 429) {
            throw new FetchException(ErrorKind.NETWORK, "Server unavailable: HTTP " + status + " from " + uri.getHost());
        }
        if (status != 200) {
            throw new FetchException(ErrorKind.UNKNOWN, "Unexpected HTTP " + status + " from " + uri.getHost());
        }

        try {
            return Optional.of(MAPPER.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new FetchException(ErrorKind.PARSE, "Failed to parse data from " + uri.getHost(), e);
        }
    }

    /**
     * Numeric field, 0 when missing or malformed.
     */
    static double number(JsonNode node, String field) {
        double value = node.path(field).asDouble(0);
        return Double.isFinite(value) ? value : 0;
    }

    static LocalDate date(JsonNode node, String field) {
        String text = node.path(field).asText("");
        if (text.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("[JsonHttpClient] Ignoring malformed date {}={}", field, text);
            return null;
        }
    }

    static Instant instant(JsonNode node, String field, Instant fallback) {
        String text = node.path(field).asText("");
        if (text.isEmpty()) {
            return fallback;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("[JsonHttpClient] Ignoring malformed timestamp {}={}", field, text);
            return fallback;
        }
    }
}
