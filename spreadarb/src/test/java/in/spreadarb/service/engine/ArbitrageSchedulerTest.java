package in.spreadarb.service.engine;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.TradeEvent;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.infrastructure.venue.QuoteUnavailableException;
import in.spreadarb.infrastructure.venue.SimulatedOrderGateway;
import in.spreadarb.service.event.TradeEventPublisher;
import in.spreadarb.service.position.EntryDecision;
import in.spreadarb.service.position.PositionManager;
import in.spreadarb.service.scanner.OpportunityScanner;
import in.spreadarb.service.sizing.PositionSizers;
import in.spreadarb.service.stats.StatisticsAggregator;
import in.spreadarb.testing.MutableClock;
import in.spreadarb.testing.StubQuoteSource;
import in.spreadarb.testing.TestConfigs;
import in.spreadarb.util.Json;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArbitrageSchedulerTest {

    private static final String BTC = "BTC/USDT";
    private static final String ETH = "ETH/USDT";
    private static final String BNB = "BNB/USDT";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
    private final StubQuoteSource reference = new StubQuoteSource("MEXC", clock)
        .price(BTC, "45000").price(ETH, "3000").price(BNB, "300");
    private final StubQuoteSource comparison = new StubQuoteSource("DEXSCREENER", clock)
        .price(BTC, "50000").price(ETH, "3300").price(BNB, "330");
    private final SimulatedOrderGateway gateway = new SimulatedOrderGateway(reference, new BigDecimal("1000"), clock);
    private final List<TradeEvent> emitted = new ArrayList<>();

    private PositionManager positions;
    private StatisticsAggregator stats;

    private ArbitrageScheduler scheduler(int maxPositions, TickTimer timer) {
        ArbitrageConfig config = TestConfigs.config(maxPositions);
        TradeEventPublisher events = new TradeEventPublisher(Json.newMapper(), List.of(emitted::add), clock);
        stats = new StatisticsAggregator(config, LocalDate.of(2024, 1, 1), events, EngineMetrics.noop());
        positions = new PositionManager(config, gateway, reference, PositionSizers.from(config.risk()),
            stats, events, EngineMetrics.noop(), clock);
        return new ArbitrageScheduler(config, reference, comparison, gateway, new OpportunityScanner(config, clock),
            positions, stats, events, EngineMetrics.noop(), clock, timer);
    }

    @Test
    void entriesFollowSymbolOrderUntilMaxPositions() {
        ArbitrageScheduler scheduler = scheduler(2, new CountingTickTimer(1));

        TickResult result = scheduler.runTick();

        assertEquals(3, result.opportunities().size());
        assertEquals(List.of(EntryDecision.Outcome.OPENED, EntryDecision.Outcome.OPENED,
                EntryDecision.Outcome.MAX_POSITIONS),
            result.entries().stream().map(EntryDecision::outcome).toList());
        assertEquals(List.of(BTC, ETH), result.entries().stream()
            .filter(EntryDecision::isOpened).map(EntryDecision::symbol).toList());
        assertEquals(2, result.opened());
        assertTrue(result.exits().isEmpty());
        assertEquals(3, stats.snapshot().opportunitiesFound());
        assertEquals(2, gateway.exposures().size());
    }

    @Test
    void hangingComparisonVenueDoesNotBlockTheTick() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));
        comparison.setHanging(true);

        long started = System.nanoTime();
        TickResult result = scheduler.runTick();
        Duration took = Duration.ofNanos(System.nanoTime() - started);

        assertEquals(3, result.referenceQuotes());
        assertEquals(0, result.comparisonQuotes());
        assertTrue(result.opportunities().isEmpty());
        assertTrue(took.compareTo(Duration.ofSeconds(2)) < 0, "Tick bounded by the fetch timeout, took " + took);
    }

    @Test
    void comparisonOutageForcesQuoteUnavailableExit() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(2));
        assertEquals(3, scheduler.runTick().opened());

        comparison.setFailing(true);
        clock.advance(Duration.ofSeconds(5));
        TickResult second = scheduler.runTick();

        assertEquals(0, second.comparisonQuotes());
        assertEquals(3, second.exits().size());
        assertTrue(second.exits().stream().allMatch(r -> r.reason() == ExitReason.QUOTE_UNAVAILABLE));
        assertEquals(0, positions.openCount());
        assertEquals(3, stats.snapshot().closedTrades());
    }

    @Test
    void staleComparisonQuoteOpensNothing() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));
        reference.remove(ETH).remove(BNB);
        comparison.price(BTC, "48500").quotedAt(BTC, clock.instant().minus(Duration.ofMinutes(5)));

        TickResult result = scheduler.runTick();

        assertEquals(1, result.referenceQuotes());
        assertEquals(1, result.comparisonQuotes());
        assertTrue(result.opportunities().isEmpty());
        assertTrue(result.entries().isEmpty());
        assertTrue(result.exits().isEmpty());
        assertTrue(gateway.exposures().isEmpty());
        assertEquals(0, stats.snapshot().closedTrades());
        assertEquals(0, stats.snapshot().totalPnl().signum());
    }

    @Test
    void convergedSpreadClosesOnNextTick() {
        ArbitrageScheduler scheduler = scheduler(1, new CountingTickTimer(2));
        scheduler.runTick();

        comparison.price(BTC, "45500");
        reference.price(BTC, "45100");
        TickResult second = scheduler.runTick();

        assertEquals(1, second.exits().size());
        assertEquals(ExitReason.TARGET_SPREAD, second.exits().get(0).reason());
        assertTrue(stats.snapshot().totalPnl().signum() > 0);
    }

    @Test
    void dateChangeArchivesTheDayOnce() {
        clock.set(Instant.parse("2024-01-01T23:59:58Z"));
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(3));
        scheduler.runTick();

        clock.advance(Duration.ofSeconds(5));
        scheduler.runTick();
        scheduler.runTick();

        assertEquals(1, stats.history().size());
        assertEquals(LocalDate.of(2024, 1, 1), stats.history().get(0).getTradeDate());
        assertEquals(1, emitted.stream().filter(e -> e.type() == EventType.DAILY_ROLLOVER).count());
    }

    @Test
    void runClosesPositionsAndReleasesResourcesOnStop() {
        CountingTickTimer timer = new CountingTickTimer(2);
        ArbitrageScheduler scheduler = scheduler(3, timer);

        scheduler.run();

        assertEquals(2, timer.awaits);
        assertFalse(scheduler.isRunning());
        assertEquals(0, positions.openCount());
        assertTrue(gateway.exposures().isEmpty());
        assertEquals(3, stats.snapshot().closedTrades());
        assertTrue(reference.isClosed());
        assertTrue(comparison.isClosed());

        TradeEvent summary = emitted.get(emitted.size() - 1);
        assertEquals(EventType.SESSION_SUMMARY, summary.type());
        assertEquals(2, summary.payload().get("ticks").asLong());
        assertEquals(0, summary.payload().get("positionsLeftOpen").asInt());
        assertTrue(emitted.stream()
            .filter(e -> e.type() == EventType.POSITION_CLOSED)
            .allMatch(e -> "SHUTDOWN".equals(e.payload().get("exitReason").asText())));
    }

    @Test
    void shutdownRunsOnlyOnce() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));

        scheduler.shutdown();
        scheduler.shutdown();

        assertEquals(1, emitted.stream().filter(e -> e.type() == EventType.SESSION_SUMMARY).count());
    }

    @Test
    void requestStopEndsLoopAfterCurrentTick() {
        CountingTickTimer timer = new CountingTickTimer(100);
        ArbitrageScheduler scheduler = scheduler(3, timer);
        scheduler.requestStop();

        scheduler.run();

        assertEquals(0, timer.awaits);
        assertTrue(timer.isCancelled());
    }

    @Test
    void statusReflectsEngineState() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));
        scheduler.runTick();

        EngineStatus status = scheduler.status();

        assertEquals("MEXC", status.referenceVenue());
        assertEquals("DEXSCREENER", status.comparisonVenue());
        assertEquals(1, status.ticks());
        assertEquals(3, status.openPositions().size());
        assertEquals(3, status.stats().totalTrades());
        assertFalse(status.running());
    }

    @Test
    void preflightChecksBalanceAndReferenceQuote() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));

        Balance balance = scheduler.preflight();

        assertEquals(0, new BigDecimal("1000").compareTo(balance.free()));
    }

    @Test
    void preflightFailsWithoutReferencePrice() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));
        reference.remove(BTC);

        assertThrows(QuoteUnavailableException.class, scheduler::preflight);
    }

    @Test
    void preflightFailsWhenReferenceVenueIsDown() {
        ArbitrageScheduler scheduler = scheduler(3, new CountingTickTimer(1));
        reference.setFailing(true);

        assertThrows(IllegalStateException.class, scheduler::preflight);
    }

    /**
     * Lets a fixed number of waits pass, then cancels itself.
     */
    private static final class CountingTickTimer implements TickTimer {
        private int remaining;
        private int awaits;
        private boolean cancelled;

        CountingTickTimer(int ticks) {
            this.remaining = ticks;
        }

        @Override
        public boolean await(Duration interval) {
            if (cancelled) {
                return false;
            }
            awaits++;
            if (--remaining <= 0) {
                cancelled = true;
                return false;
            }
            return true;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
