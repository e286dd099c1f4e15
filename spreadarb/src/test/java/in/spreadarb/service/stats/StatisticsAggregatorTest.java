package in.spreadarb.service.stats;

import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.monitoring.DailyPerformance;
import in.spreadarb.domain.monitoring.SessionStats;
import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.domain.trade.PositionStatus;
import in.spreadarb.domain.trade.Side;
import in.spreadarb.domain.trade.TradeEvent;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.service.event.TradeEventPublisher;
import in.spreadarb.testing.MutableClock;
import in.spreadarb.testing.TestConfigs;
import in.spreadarb.util.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsAggregatorTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 1, 2);

    private final List<TradeEvent> emitted = new ArrayList<>();
    private MutableClock clock;
    private StatisticsAggregator stats;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T23:59:00Z"));
        TradeEventPublisher events = new TradeEventPublisher(Json.newMapper(), List.of(emitted::add), clock);
        stats = new StatisticsAggregator(TestConfigs.config(3), DAY_1, events, EngineMetrics.noop());
    }

    @Test
    void opensCountTradesAndClosesMovePnl() {
        stats.recordOpen(position("BTC/USDT"));
        stats.recordOpen(position("ETH/USDT"));
        stats.recordClose(trade("BTC/USDT", "19.92"));

        SessionStats s = stats.snapshot();
        assertEquals(2, s.totalTrades());
        assertEquals(2, s.dailyTradeCount());
        assertEquals(1, s.closedTrades());
        assertEquals(1, s.winningTrades());
        assertEquals(0, new BigDecimal("19.92").compareTo(s.totalPnl()));
        assertEquals(0, new BigDecimal("19.92").compareTo(s.dailyPnl()));
        assertEquals(50.0, s.winRate(), 1e-9);
    }

    @Test
    void winRateIsZeroWithoutTrades() {
        assertEquals(0.0, stats.snapshot().winRate());
    }

    @Test
    void rolloverArchivesExactlyOnceAndResetsDailyFields() {
        stats.recordOpen(position("BTC/USDT"));
        stats.recordClose(trade("BTC/USDT", "-4.08"));
        stats.recordOpen(position("ETH/USDT"));
        stats.recordClose(trade("ETH/USDT", "6.00"));

        assertTrue(stats.onTick(DAY_1).isEmpty(), "Same day never archives");

        Optional<DailyPerformance> archived = stats.onTick(DAY_2);
        Optional<DailyPerformance> again = stats.onTick(DAY_2);

        assertTrue(archived.isPresent());
        assertTrue(again.isEmpty(), "Second tick on the new day must not archive again");

        DailyPerformance day = archived.get();
        assertEquals(DAY_1, day.getTradeDate());
        assertEquals(2, day.getTradesOpened());
        assertEquals(2, day.getTradesClosed());
        assertEquals(1, day.getWinningTrades());
        assertEquals(1, day.getLosingTrades());
        assertEquals(0, new BigDecimal("1.92").compareTo(day.getTotalPnl()));
        assertEquals(0, new BigDecimal("6.00").compareTo(day.getBestTrade()));
        assertEquals(0, new BigDecimal("-4.08").compareTo(day.getWorstTrade()));

        SessionStats s = stats.snapshot();
        assertEquals(0, s.dailyPnl().signum());
        assertEquals(0, s.dailyTradeCount());
        assertEquals(DAY_2, s.lastResetDate());
        assertEquals(2, s.totalTrades(), "Cumulative counters survive the rollover");
        assertEquals(0, new BigDecimal("1.92").compareTo(s.totalPnl()));

        assertEquals(List.of(day), stats.history());
        assertEquals(1, emitted.stream().filter(e -> e.type() == EventType.DAILY_ROLLOVER).count());
        assertTrue(emitted.get(0).isSessionLevel());
    }

    @Test
    void dailyLossLimitTriggersAtTheBoundary() {
        stats.recordClose(trade("BTC/USDT", "-49.99"));
        assertFalse(stats.isDailyLossLimitReached());

        stats.recordClose(trade("ETH/USDT", "-0.01"));
        assertTrue(stats.isDailyLossLimitReached(), "-50.00 reaches a 50 limit");

        stats.onTick(DAY_2);
        assertFalse(stats.isDailyLossLimitReached(), "New day starts fresh");
    }

    @Test
    void profitsNeverTriggerTheLossLimit() {
        stats.recordClose(trade("BTC/USDT", "500"));

        assertFalse(stats.isDailyLossLimitReached());
    }

    @Test
    void opportunitiesAccumulate() {
        stats.recordOpportunities(2);
        stats.recordOpportunities(0);
        stats.recordOpportunities(1);

        assertEquals(3, stats.snapshot().opportunitiesFound());
    }

    private Position position(String symbol) {
        return new Position(symbol, Side.LONG, BigDecimal.ONE, new BigDecimal("100"), new BigDecimal("8"),
            clock.instant(), new BigDecimal("1.5"), new BigDecimal("98"), new BigDecimal("104"),
            PositionStatus.OPEN, "SIM-1");
    }

    private ClosedTrade trade(String symbol, String pnl) {
        BigDecimal value = new BigDecimal(pnl);
        return new ClosedTrade(position(symbol).withStatus(PositionStatus.CLOSING).withStatus(PositionStatus.CLOSED),
            new BigDecimal("100"), clock.instant(), ExitReason.TARGET_SPREAD, value, BigDecimal.ZERO, value);
    }
}
