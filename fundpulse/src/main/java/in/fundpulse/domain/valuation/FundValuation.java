package in.fundpulse.domain.valuation;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Valuation published by the primary provider for one fund.
 *
 * @param realValue      the provider's value is today's official net value, not an estimate
 * @param tradingSession the provider's estimate belongs to a live trading session
 */
public record FundValuation(
    String fundCode,
    double netValue,
    LocalDate netValueDate,
    double estimatedValue,
    double estimatedChange,
    Instant updateTime,
    boolean realValue,
    boolean tradingSession
) {}
