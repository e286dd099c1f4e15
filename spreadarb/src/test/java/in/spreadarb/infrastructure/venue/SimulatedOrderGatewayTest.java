package in.spreadarb.infrastructure.venue;

import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.domain.order.OrderFill;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.trade.Side;
import in.spreadarb.testing.MutableClock;
import in.spreadarb.testing.StubQuoteSource;
import in.spreadarb.util.Futures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedOrderGatewayTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private StubQuoteSource reference;
    private SimulatedOrderGateway gateway;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        reference = new StubQuoteSource("MEXC", clock).price("BTC/USDT", "45000");
        gateway = new SimulatedOrderGateway(reference, new BigDecimal("1000"), clock);
    }

    @Test
    void opensAtReferencePriceAndTracksExposure() {
        OrderFill fill = Futures.await(gateway.open("BTC/USDT", Side.LONG, new BigDecimal("0.002")), TIMEOUT);

        assertEquals(OrderStatus.FILLED, fill.status());
        assertTrue(fill.simulated());
        assertEquals("SIM-1", fill.orderId());
        assertEquals(0, new BigDecimal("45000").compareTo(fill.fillPrice()));
        assertEquals(Side.LONG, gateway.exposure("BTC/USDT").orElseThrow().side());
        assertEquals(GatewayMode.TEST, gateway.mode());
    }

    @Test
    void secondOpenOnSameSymbolIsRejected() {
        Futures.await(gateway.open("BTC/USDT", Side.LONG, BigDecimal.ONE), TIMEOUT);

        GatewayRejectedException e = assertThrows(GatewayRejectedException.class,
            () -> Futures.await(gateway.open("BTC/USDT", Side.SHORT, BigDecimal.ONE), TIMEOUT));
        assertEquals("open", e.getOperation());
    }

    @Test
    void openWithoutQuoteFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> gateway.open("ETH/USDT", Side.LONG, BigDecimal.ONE).get());

        assertInstanceOf(GatewayRejectedException.class, e.getCause());
        assertTrue(gateway.exposures().isEmpty());
    }

    @Test
    void nonPositiveSizeIsRejected() {
        assertTrue(gateway.open("BTC/USDT", Side.LONG, BigDecimal.ZERO).isCompletedExceptionally());
    }

    @Test
    void closeFillsAtCurrentQuoteAndClearsExposure() {
        Futures.await(gateway.open("BTC/USDT", Side.SHORT, BigDecimal.ONE), TIMEOUT);
        reference.price("BTC/USDT", "44000");

        OrderFill fill = Futures.await(gateway.close("BTC/USDT"), TIMEOUT);

        assertEquals(0, new BigDecimal("44000").compareTo(fill.fillPrice()));
        assertEquals(Side.SHORT, fill.side());
        assertEquals("SIM-2", fill.orderId());
        assertTrue(gateway.exposure("BTC/USDT").isEmpty());
    }

    @Test
    void closeWithoutQuoteStillClosesWithoutPrice() {
        Futures.await(gateway.open("BTC/USDT", Side.LONG, BigDecimal.ONE), TIMEOUT);
        reference.remove("BTC/USDT");

        OrderFill fill = Futures.await(gateway.close("BTC/USDT"), TIMEOUT);

        assertTrue(fill.isAccepted());
        assertFalse(fill.hasFillPrice());
        assertTrue(gateway.exposures().isEmpty());
    }

    @Test
    void closeWithoutExposureFails() {
        assertThrows(GatewayRejectedException.class, () -> Futures.await(gateway.close("BTC/USDT"), TIMEOUT));
    }

    @Test
    void balanceIsThePaperBalance() {
        Balance balance = Futures.await(gateway.balance(), TIMEOUT);

        assertEquals(0, new BigDecimal("1000").compareTo(balance.free()));
        assertEquals(0, new BigDecimal("1000").compareTo(balance.total()));
    }
}
