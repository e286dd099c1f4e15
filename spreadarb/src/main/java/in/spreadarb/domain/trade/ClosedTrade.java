package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Realized result of a closed position.
 */
public record ClosedTrade(
    Position position,
    BigDecimal exitPrice,
    Instant exitTime,
    ExitReason exitReason,
    BigDecimal grossPnl,
    BigDecimal fees,
    BigDecimal pnl
) {
    public boolean isWinner() {
        return pnl.signum() > 0;
    }

    public String symbol() {
        return position.symbol();
    }
}
