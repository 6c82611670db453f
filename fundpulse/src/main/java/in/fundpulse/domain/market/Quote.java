package in.fundpulse.domain.market;

/**
 * Latest price snapshot for one instrument. Produced per refresh cycle, never persisted.
 */
public record Quote(
    String code,
    String name,
    double price,
    double change,
    double changeAmount
) {
    public Quote {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be blank");
        }
    }
}
