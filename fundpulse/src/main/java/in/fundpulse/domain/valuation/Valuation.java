package in.fundpulse.domain.valuation;

import java.time.Instant;

/**
 * Valuation computed from holdings and quotes.
 *
 * @param complete every holding had a quote and the fund has at least one holding
 */
public record Valuation(
    double estimatedValue,
    double estimatedChange,
    Instant updateTime,
    boolean complete
) {}
