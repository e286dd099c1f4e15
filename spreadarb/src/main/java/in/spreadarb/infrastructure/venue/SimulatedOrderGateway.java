package in.spreadarb.infrastructure.venue;

import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.domain.order.OrderFill;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.trade.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TEST-mode gateway. Fills immediately at the current reference quote, keeps track of the
 * simulated exposure per symbol and reports a fixed paper balance. Nothing is settled.
 */
public final class SimulatedOrderGateway implements OrderGateway {
    private static final Logger log = LoggerFactory.getLogger(SimulatedOrderGateway.class);
    private static final String VENUE = "SIMULATED";

    private final QuoteSource referenceSource;
    private final BigDecimal paperBalance;
    private final Clock clock;
    private final AtomicLong orderSeq = new AtomicLong(0);
    private final ConcurrentHashMap<String, Exposure> exposures = new ConcurrentHashMap<>();

    public SimulatedOrderGateway(QuoteSource referenceSource, BigDecimal paperBalance, Clock clock) {
        this.referenceSource = referenceSource;
        this.paperBalance = paperBalance;
        this.clock = clock;
    }

    @Override
    public GatewayMode mode() {
        return GatewayMode.TEST;
    }

    @Override
    public CompletableFuture<OrderFill> open(String symbol, Side side, BigDecimal size) {
        if (size == null || size.signum() <= 0) {
            return CompletableFuture.failedFuture(
                new GatewayRejectedException(VENUE, symbol, "open", "size must be positive"));
        }
        if (exposures.containsKey(symbol)) {
            return CompletableFuture.failedFuture(
                new GatewayRejectedException(VENUE, symbol, "open", "exposure already open"));
        }

        return referenceSource.getQuote(symbol).thenApply(quote -> {
            Quote q = quote.orElseThrow(() ->
                new GatewayRejectedException(VENUE, symbol, "open", "no reference price"));

            String orderId = nextOrderId();
            exposures.put(symbol, new Exposure(side, size, q.price()));
            log.info("🧪 [TEST] Simulated {} {} {} @ {} (order {})",
                side.openAction(), size.toPlainString(), symbol, q.price().toPlainString(), orderId);

            return new OrderFill(orderId, symbol, side, size, q.price(), OrderStatus.FILLED,
                clock.instant(), true, "simulated");
        });
    }

    @Override
    public CompletableFuture<OrderFill> close(String symbol) {
        Exposure exposure = exposures.get(symbol);
        if (exposure == null) {
            return CompletableFuture.failedFuture(
                new GatewayRejectedException(VENUE, symbol, "close", "no simulated exposure"));
        }

        return referenceSource.getQuote(symbol).thenApply(quote -> {
            BigDecimal price = quote.map(Quote::price).orElse(null);
            exposures.remove(symbol);
            String orderId = nextOrderId();
            log.info("🧪 [TEST] Simulated {} {} {} @ {} (order {})",
                exposure.side().closeAction(), exposure.size().toPlainString(), symbol,
                price != null ? price.toPlainString() : "n/a", orderId);

            return new OrderFill(orderId, symbol, exposure.side(), exposure.size(), price, OrderStatus.FILLED,
                clock.instant(), true, "simulated");
        });
    }

    @Override
    public CompletableFuture<Balance> balance() {
        return CompletableFuture.completedFuture(Balance.of(paperBalance));
    }

    /**
     * Simulated exposure per symbol (read-only view).
     */
    public Map<String, Exposure> exposures() {
        return Map.copyOf(exposures);
    }

    public Optional<Exposure> exposure(String symbol) {
        return Optional.ofNullable(exposures.get(symbol));
    }

    @Override
    public void close() {
        if (!exposures.isEmpty()) {
            log.warn("[TEST] Gateway closed with {} simulated exposures: {}", exposures.size(), exposures.keySet());
        }
        exposures.clear();
    }

    private String nextOrderId() {
        return "SIM-" + orderSeq.incrementAndGet();
    }

    public record Exposure(Side side, BigDecimal size, BigDecimal entryPrice) {}
}
