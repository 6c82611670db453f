package in.fundpulse.domain.fund;

import in.fundpulse.domain.valuation.FundValuation;
import in.fundpulse.domain.valuation.Valuation;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A tracked fund and its latest published numbers.
 *
 * Funds are immutable. A refresh cycle produces a new Fund per tracked code;
 * the holdings list keeps its length and order across refreshes.
 */
public record Fund(
    String code,
    String name,
    double netValue,
    LocalDate netValueDate,
    double estimatedValue,
    double estimatedChange,
    Instant updateTime,
    boolean realValue,
    List<Holding> holdings
) {
    public Fund {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be blank");
        }
        holdings = holdings == null ? List.of() : List.copyOf(holdings);
    }

    /**
     * Apply a primary provider valuation. The official net value and its date are
     * only replaced when the provider reports a published (real) value.
     */
    public Fund withPrimaryValuation(FundValuation valuation, List<Holding> newHoldings) {
        return new Fund(
            code,
            name,
            valuation.realValue() ? valuation.netValue() : netValue,
            valuation.realValue() ? valuation.netValueDate() : netValueDate,
            valuation.estimatedValue(),
            valuation.estimatedChange(),
            valuation.updateTime(),
            valuation.realValue(),
            newHoldings
        );
    }

    /**
     * Apply a valuation computed from holdings. Always an estimate.
     */
    public Fund withEstimatedValuation(Valuation valuation, List<Holding> newHoldings) {
        return new Fund(code, name, netValue, netValueDate, valuation.estimatedValue(),
            valuation.estimatedChange(), valuation.updateTime(), false, newHoldings);
    }
}
