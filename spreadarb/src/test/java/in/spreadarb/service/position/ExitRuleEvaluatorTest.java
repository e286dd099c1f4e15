package in.spreadarb.service.position;

import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.domain.trade.PositionStatus;
import in.spreadarb.domain.trade.Side;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Long position at 100: stop 98, take 104, target spread 1.5%, max hold 1h, max quote age 30s.
 */
class ExitRuleEvaluatorTest {

    private static final Instant ENTRY = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant NOW = ENTRY.plusSeconds(60);

    private final ExitRuleEvaluator rules = new ExitRuleEvaluator(Duration.ofSeconds(30), Duration.ofHours(1));
    private final Position longPosition = new Position("BTC/USDT", Side.LONG, BigDecimal.ONE,
        new BigDecimal("100"), new BigDecimal("8"), ENTRY, new BigDecimal("1.5"),
        new BigDecimal("98"), new BigDecimal("104"), PositionStatus.OPEN, "SIM-1");

    @Test
    void noRuleMatchesKeepsPositionOpen() {
        assertEquals(Optional.empty(), rules.evaluate(longPosition, q("100"), q("108"), NOW));
    }

    @Test
    void missingQuoteForcesExit() {
        assertEquals(Optional.of(ExitReason.QUOTE_UNAVAILABLE), rules.evaluate(longPosition, q("100"), null, NOW));
        assertEquals(Optional.of(ExitReason.QUOTE_UNAVAILABLE), rules.evaluate(longPosition, null, q("100"), NOW));
    }

    @Test
    void staleQuoteForcesExitEvenWhenSpreadConverged() {
        Quote stale = Quote.of("BTC/USDT", new BigDecimal("100.5"), NOW.minusSeconds(31));

        assertEquals(Optional.of(ExitReason.QUOTE_UNAVAILABLE), rules.evaluate(longPosition, q("100"), stale, NOW));
    }

    @Test
    void convergedSpreadClosesPosition() {
        assertEquals(Optional.of(ExitReason.TARGET_SPREAD), rules.evaluate(longPosition, q("100"), q("101.2"), NOW));
    }

    @Test
    void targetSpreadWinsOverStopLoss() {
        // ref 97 is below the stop, but the spread has also converged
        assertEquals(Optional.of(ExitReason.TARGET_SPREAD), rules.evaluate(longPosition, q("97"), q("97.5"), NOW));
    }

    @Test
    void stopLossBreached() {
        assertEquals(Optional.of(ExitReason.STOP_LOSS), rules.evaluate(longPosition, q("98"), q("110"), NOW));
    }

    @Test
    void takeProfitReached() {
        assertEquals(Optional.of(ExitReason.TAKE_PROFIT), rules.evaluate(longPosition, q("104"), q("115"), NOW));
    }

    @Test
    void maxHoldTimeExceeded() {
        Instant later = ENTRY.plus(Duration.ofHours(1)).plusSeconds(1);
        Quote ref = Quote.of("BTC/USDT", new BigDecimal("100"), later);
        Quote cmp = Quote.of("BTC/USDT", new BigDecimal("108"), later);

        assertEquals(Optional.of(ExitReason.MAX_HOLD_TIME), rules.evaluate(longPosition, ref, cmp, later));
    }

    @Test
    void shortStopAndTakeAreMirrored() {
        Position shortPosition = new Position("BTC/USDT", Side.SHORT, BigDecimal.ONE,
            new BigDecimal("100"), new BigDecimal("8"), ENTRY, new BigDecimal("1.5"),
            new BigDecimal("102"), new BigDecimal("96"), PositionStatus.OPEN, "SIM-2");

        assertEquals(Optional.of(ExitReason.STOP_LOSS), rules.evaluate(shortPosition, q("102"), q("90"), NOW));
        assertEquals(Optional.of(ExitReason.TAKE_PROFIT), rules.evaluate(shortPosition, q("96"), q("85"), NOW));
        assertEquals(Optional.empty(), rules.evaluate(shortPosition, q("100"), q("92"), NOW));
    }

    private static Quote q(String price) {
        return Quote.of("BTC/USDT", new BigDecimal(price), NOW);
    }
}
