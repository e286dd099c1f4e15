package in.spreadarb.infrastructure.venue;

import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.domain.order.OrderFill;
import in.spreadarb.domain.trade.Side;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Order gateway for the reference venue.
 *
 * A request fails either by completing exceptionally (usually with
 * {@link GatewayRejectedException}) or by returning a fill whose status is REJECTED.
 */
public interface OrderGateway extends AutoCloseable {

    /**
     * TEST or LIVE. Fixed for the lifetime of the gateway.
     */
    GatewayMode mode();

    /**
     * Open exposure at market.
     */
    CompletableFuture<OrderFill> open(String symbol, Side side, BigDecimal size);

    /**
     * Close all exposure on a symbol at market.
     */
    CompletableFuture<OrderFill> close(String symbol);

    /**
     * Quote-currency balance.
     */
    CompletableFuture<Balance> balance();

    @Override
    void close();
}
