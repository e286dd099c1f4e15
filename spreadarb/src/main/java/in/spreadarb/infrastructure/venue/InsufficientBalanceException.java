package in.spreadarb.infrastructure.venue;

import java.math.BigDecimal;

/**
 * Raised when free balance does not cover the required amount for an entry.
 */
public class InsufficientBalanceException extends RuntimeException {

    private final String symbol;
    private final BigDecimal free;
    private final BigDecimal required;

    public InsufficientBalanceException(String symbol, BigDecimal free, BigDecimal required) {
        super(String.format("Insufficient balance for %s: free=%s required=%s",
            symbol, free.toPlainString(), required.toPlainString()));
        this.symbol = symbol;
        this.free = free;
        this.required = required;
    }

    public String getSymbol() {
        return symbol;
    }

    public BigDecimal getFree() {
        return free;
    }

    public BigDecimal getRequired() {
        return required;
    }
}
