package in.fundpulse.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import in.fundpulse.application.port.output.QuoteProvider;
import in.fundpulse.domain.market.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Real-time quote source over HTTP.
 *
 * GET {baseUrl}/quotes?codes=600519,000858
 * <pre>
 * [{"code":"600519","name":"Kweichow Moutai","price":1688.0,"change":1.25,"changeAmount":20.84}]
 * </pre>
 * Entries without a code are dropped; codes the provider does not return are simply absent.
 */
public class HttpQuoteProvider implements QuoteProvider {
    private static final Logger log = LoggerFactory.getLogger(HttpQuoteProvider.class);

    private final URI baseUrl;
    private final JsonHttpClient client;

    public HttpQuoteProvider(URI baseUrl, Duration timeout) {
        this(baseUrl, new JsonHttpClient(timeout));
    }

    HttpQuoteProvider(URI baseUrl, JsonHttpClient client) {
        this.baseUrl = baseUrl;
        this.client = client;
    }

    @Override
    public CompletableFuture<List<Quote>> getQuotes(Set<String> codes) {
        if (codes.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        String query = URLEncoder.encode(String.join(",", codes), StandardCharsets.UTF_8);
        URI uri = baseUrl.resolve("quotes?codes=" + query);

        return client.get(uri).thenApply(body -> body.map(this::toQuotes).orElse(List.of()));
    }

    private List<Quote> toQuotes(JsonNode array) {
        List<Quote> quotes = new ArrayList<>();
        for (JsonNode node : array) {
            String code = node.path("code").asText("");
            if (code.isBlank()) {
                log.debug("[HttpQuoteProvider] Skipping quote without code: {}", node);
                continue;
            }
            quotes.add(new Quote(
                code,
                node.path("name").asText(""),
                JsonHttpClient.number(node, "price"),
                JsonHttpClient.number(node, "change"),
                JsonHttpClient.number(node, "changeAmount")
            ));
        }
        return quotes;
    }
}
