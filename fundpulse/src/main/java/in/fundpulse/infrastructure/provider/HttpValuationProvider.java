package in.fundpulse.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.fundpulse.application.port.output.ValuationProvider;
import in.fundpulse.domain.valuation.FundValuation;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Primary valuation source over HTTP.
 *
 * GET {baseUrl}/valuations/{fundCode}
 * <pre>
 * {"fundCode":"161725","netValue":1.2345,"netValueDate":"2024-03-01",
 *  "estimatedValue":1.2401,"estimatedChange":0.45,"updateTime":"2024-03-04T06:30:00Z",
 *  "realValue":false,"tradingSession":true}
 * </pre>
 * Missing or malformed numbers read as 0. A 404 means the provider has no valuation.
 */
public class HttpValuationProvider implements ValuationProvider {

    private final URI baseUrl;
    private final JsonHttpClient client;
    private final Clock clock;

    public HttpValuationProvider(URI baseUrl, Duration timeout, Clock clock) {
        this(baseUrl, new JsonHttpClient(timeout), clock);
    }

    HttpValuationProvider(URI baseUrl, JsonHttpClient client, Clock clock) {
        this.baseUrl = baseUrl;
        this.client = client;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Optional<FundValuation>> getValuation(String fundCode) {
        URI uri = baseUrl.resolve("valuations/" + URLEncoder.encode(fundCode, StandardCharsets.UTF_8));
        return client.get(uri).thenApply(body -> body.map(node -> toValuation(fundCode, node)));
    }

    private FundValuation toValuation(String fundCode, JsonNode node) {
        return new FundValuation(
            node.path("fundCode").asText(fundCode),
            JsonHttpClient.number(node, "netValue"),
            JsonHttpClient.date(node, "netValueDate"),
            JsonHttpClient.number(node, "estimatedValue"),
            JsonHttpClient.number(node, "estimatedChange"),
            JsonHttpClient.instant(node, "updateTime", clock.instant()),
            node.path("realValue").asBoolean(false),
            node.path("tradingSession").asBoolean(false)
        );
    }
}
