package in.spreadarb.domain.order;

import java.math.BigDecimal;

/**
 * Quote-currency balance (USDT) on the reference venue.
 */
public record Balance(BigDecimal free, BigDecimal total) {
    public Balance {
        if (free == null || total == null) {
            throw new IllegalArgumentException("free and total cannot be null");
        }
    }

    public static Balance of(BigDecimal amount) {
        return new Balance(amount, amount);
    }
}
