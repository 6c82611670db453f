package in.fundpulse.application.port.output;

import in.fundpulse.domain.valuation.FundValuation;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Primary source of per-fund valuations.
 */
public interface ValuationProvider {

    /**
     * @return the provider's valuation, empty when the provider has none for this fund
     */
    CompletableFuture<Optional<FundValuation>> getValuation(String fundCode);
}
