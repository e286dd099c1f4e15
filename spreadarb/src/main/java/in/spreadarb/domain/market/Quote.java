package in.spreadarb.domain.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Latest price of one symbol on one venue.
 *
 * {@code sourceCount} is the number of upstream prices that were combined into this quote
 * (1 for a plain ticker).
 */
public record Quote(
    String symbol,
    BigDecimal price,
    Instant timestamp,
    int sourceCount
) {
    public Quote {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive for " + symbol + ": " + price);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
    }

    public static Quote of(String symbol, BigDecimal price, Instant timestamp) {
        return new Quote(symbol, price, timestamp, 1);
    }

    /**
     * True when the quote is older than {@code maxAge} at {@code now}.
     */
    public boolean isStale(Instant now, Duration maxAge) {
        return Duration.between(timestamp, now).compareTo(maxAge) > 0;
    }
}
