package in.fundpulse.service.valuation;

import in.fundpulse.domain.fund.Fund;
import in.fundpulse.domain.fund.Holding;
import in.fundpulse.domain.market.Quote;
import in.fundpulse.domain.valuation.Valuation;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates a fund's change from the real-time changes of its top holdings.
 *
 * weighted change = Σ quote.change × holding.ratio / 100, over holdings that have a quote
 * estimated value  = netValue × (1 + weighted change / 100)
 *
 * All operations are pure and total. Inputs are expected to be normalised
 * (no NaN) by the providers.
 */
public final class ValuationCalculator {

    private final Clock clock;

    public ValuationCalculator() {
        this(Clock.systemUTC());
    }

    public ValuationCalculator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Value a fund from its holdings and the given quotes.
     */
    public Valuation calculateValuation(Fund fund, List<Quote> quotes) {
        Map<String, Quote> quoteByCode = new HashMap<>();
        for (Quote quote : quotes) {
            quoteByCode.put(quote.code(), quote);
        }
        return calculateValuation(fund, quoteByCode);
    }

    public Valuation calculateValuation(Fund fund, Map<String, Quote> quoteByCode) {
        WeightedChange weighted = calculateWeightedChange(fund.holdings(), quoteByCode);
        double estimatedValue = calculateEstimatedValue(fund.netValue(), weighted.estimatedChange());
        return new Valuation(estimatedValue, weighted.estimatedChange(), clock.instant(), weighted.complete());
    }

    /**
     * Weighted change over the holdings that have a quote.
     * Complete only when every holding matched and there is at least one holding.
     */
    public WeightedChange calculateWeightedChange(List<Holding> holdings, Map<String, Quote> quoteByCode) {
        double totalChange = 0;
        int matched = 0;

        for (Holding holding : holdings) {
            Quote quote = quoteByCode.get(holding.stockCode());
            if (quote != null) {
                // ratio is a percentage, 8.5 means 8.5%
                totalChange += quote.change() * (holding.ratio() / 100);
                matched++;
            }
        }

        return new WeightedChange(totalChange, matched == holdings.size() && !holdings.isEmpty());
    }

    /**
     * @param estimatedChange percent, 0.8 means +0.8%
     */
    public double calculateEstimatedValue(double netValue, double estimatedChange) {
        return netValue * (1 + estimatedChange / 100);
    }

    public record WeightedChange(double estimatedChange, boolean complete) {}
}
