package in.spreadarb.domain.order;

import in.spreadarb.domain.trade.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Gateway response to an open or close request.
 *
 * {@code fillPrice} may be null when the venue does not report an average price; callers fall
 * back to the quote they acted on.
 */
public record OrderFill(
    String orderId,
    String symbol,
    Side side,
    BigDecimal size,
    BigDecimal fillPrice,
    OrderStatus status,
    Instant filledAt,
    boolean simulated,
    String statusMessage
) {
    public boolean isAccepted() {
        return status == OrderStatus.FILLED || status == OrderStatus.PLACED;
    }

    public boolean hasFillPrice() {
        return fillPrice != null && fillPrice.signum() > 0;
    }

    public static OrderFill rejected(String symbol, Side side, BigDecimal size, String message) {
        return new OrderFill(null, symbol, side, size, null, OrderStatus.REJECTED, Instant.now(), false, message);
    }
}
