package in.fundpulse.application.port.output;

import in.fundpulse.domain.market.Quote;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort source of real-time quotes. A code missing from the result means
 * "unavailable this cycle", not an error.
 */
public interface QuoteProvider {
    CompletableFuture<List<Quote>> getQuotes(Set<String> codes);
}
