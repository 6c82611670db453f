package in.fundpulse.domain.fund;

import in.fundpulse.domain.market.Quote;

/**
 * One of a fund's top-weighted positions.
 *
 * @param stockCode instrument code, the key used to match quotes
 * @param stockName display name
 * @param ratio     portfolio weight in percent (8.5 means 8.5%)
 * @param change    last known price change in percent
 * @param price     last known price
 */
public record Holding(
    String stockCode,
    String stockName,
    double ratio,
    double change,
    double price
) {
    public Holding {
        if (stockCode == null || stockCode.isBlank()) {
            throw new IllegalArgumentException("stockCode cannot be blank");
        }
    }

    /**
     * Copy of this holding carrying the quote's change and price.
     * A null quote means no data this cycle: the prior values are kept.
     */
    public Holding withQuote(Quote quote) {
        if (quote == null) {
            return this;
        }
        return new Holding(stockCode, stockName, ratio, quote.change(), quote.price());
    }
}
