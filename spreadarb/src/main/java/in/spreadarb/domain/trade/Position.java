package in.spreadarb.domain.trade;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Open exposure on the reference venue awaiting a convergence or risk-based exit.
 *
 * Immutable; the position manager replaces the record on every status transition.
 */
public record Position(
    String symbol,
    Side side,
    BigDecimal size,
    BigDecimal entryPrice,
    BigDecimal entrySpread,
    Instant entryTime,
    BigDecimal targetSpread,
    BigDecimal stopLossPrice,
    BigDecimal takeProfitPrice,
    PositionStatus status,
    String orderId
) {
    public Position {
        if (size == null || size.signum() <= 0) {
            throw new IllegalArgumentException("Size must be positive for " + symbol);
        }
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /**
     * Copy in a new status. Rejects transitions the lifecycle does not allow.
     */
    public Position withStatus(PositionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Illegal position transition for " + symbol + ": " + status + " → " + next);
        }
        return new Position(symbol, side, size, entryPrice, entrySpread, entryTime,
            targetSpread, stopLossPrice, takeProfitPrice, next, orderId);
    }

    /**
     * LONG: price at or below the stop. SHORT: price at or above the stop.
     */
    public boolean isStopLossBreached(BigDecimal referencePrice) {
        return side == Side.LONG
            ? referencePrice.compareTo(stopLossPrice) <= 0
            : referencePrice.compareTo(stopLossPrice) >= 0;
    }

    /**
     * LONG: price at or above the target. SHORT: price at or below the target.
     */
    public boolean isTakeProfitReached(BigDecimal referencePrice) {
        return side == Side.LONG
            ? referencePrice.compareTo(takeProfitPrice) >= 0
            : referencePrice.compareTo(takeProfitPrice) <= 0;
    }

    public boolean isHeldLongerThan(Duration maxHold, Instant now) {
        return Duration.between(entryTime, now).compareTo(maxHold) > 0;
    }
}
