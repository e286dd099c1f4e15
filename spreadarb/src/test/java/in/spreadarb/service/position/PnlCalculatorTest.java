package in.spreadarb.service.position;

import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.domain.trade.PositionStatus;
import in.spreadarb.domain.trade.Side;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PnlCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");
    private final PnlCalculator calculator = new PnlCalculator(BigDecimal.valueOf(2), new BigDecimal("0.0004"));

    @Test
    void longWinnerIsLeveragedAndNetOfFees() {
        ClosedTrade trade = calculator.realize(position(Side.LONG, "100", "1"), new BigDecimal("110"),
            NOW, ExitReason.TAKE_PROFIT);

        assertEquals(0, new BigDecimal("20").compareTo(trade.grossPnl()));
        assertEquals(0, new BigDecimal("0.08").compareTo(trade.fees()));
        assertEquals(0, new BigDecimal("19.92").compareTo(trade.pnl()));
        assertTrue(trade.isWinner());
    }

    @Test
    void shortProfitsWhenPriceFalls() {
        ClosedTrade trade = calculator.realize(position(Side.SHORT, "100", "2"), new BigDecimal("95"),
            NOW, ExitReason.TARGET_SPREAD);

        // (100 - 95) * 2 * 2 = 20, fees 100 * 2 * 0.0004 * 2 = 0.16
        assertEquals(0, new BigDecimal("19.84").compareTo(trade.pnl()));
    }

    @Test
    void shortLosesWhenPriceRises() {
        ClosedTrade trade = calculator.realize(position(Side.SHORT, "100", "1"), new BigDecimal("102"),
            NOW, ExitReason.STOP_LOSS);

        assertEquals(0, new BigDecimal("-4.08").compareTo(trade.pnl()));
        assertFalse(trade.isWinner());
    }

    @Test
    void flatExitLosesOnlyFees() {
        ClosedTrade trade = calculator.realize(position(Side.LONG, "100", "1"), new BigDecimal("100"),
            NOW, ExitReason.MAX_HOLD_TIME);

        assertEquals(0, new BigDecimal("-0.08").compareTo(trade.pnl()));
        assertFalse(trade.isWinner());
    }

    private static Position position(Side side, String entry, String size) {
        BigDecimal e = new BigDecimal(entry);
        return new Position("BTC/USDT", side, new BigDecimal(size), e, new BigDecimal("8"), NOW,
            new BigDecimal("1.5"), e, e, PositionStatus.CLOSED, "SIM-1");
    }
}
