package in.spreadarb.service.engine;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.monitoring.SessionStats;
import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.signal.Opportunity;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.infrastructure.venue.OrderGateway;
import in.spreadarb.infrastructure.venue.QuoteSource;
import in.spreadarb.infrastructure.venue.QuoteUnavailableException;
import in.spreadarb.service.event.TradeEventPublisher;
import in.spreadarb.service.position.CloseResult;
import in.spreadarb.service.position.EntryDecision;
import in.spreadarb.service.position.PositionManager;
import in.spreadarb.service.scanner.OpportunityScanner;
import in.spreadarb.service.stats.StatisticsAggregator;
import in.spreadarb.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single cooperative trading loop.
 *
 * Each tick:
 * 1. Fetch quotes from both venues concurrently, each bounded by quoteFetchTimeout
 * 2. Scan for opportunities
 * 3. Offer opportunities to the position manager in configured symbol order
 * 4. Evaluate exits for all open positions
 * 5. Daily rollover and periodic stats log
 * 6. Wait on the tick timer
 *
 * Stop requests are honoured between ticks only. On exit every open position is closed, a
 * session summary is emitted and collaborators are released.
 */
public final class ArbitrageScheduler {
    private static final Logger log = LoggerFactory.getLogger(ArbitrageScheduler.class);

    private final ArbitrageConfig config;
    private final QuoteSource referenceSource;
    private final QuoteSource comparisonSource;
    private final OrderGateway gateway;
    private final OpportunityScanner scanner;
    private final PositionManager positionManager;
    private final StatisticsAggregator stats;
    private final TradeEventPublisher events;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final TickTimer tickTimer;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong(0);
    private volatile Instant startedAt;

    public ArbitrageScheduler(ArbitrageConfig config,
                              QuoteSource referenceSource,
                              QuoteSource comparisonSource,
                              OrderGateway gateway,
                              OpportunityScanner scanner,
                              PositionManager positionManager,
                              StatisticsAggregator stats,
                              TradeEventPublisher events,
                              EngineMetrics metrics,
                              Clock clock,
                              TickTimer tickTimer) {
        this.config = config;
        this.referenceSource = referenceSource;
        this.comparisonSource = comparisonSource;
        this.gateway = gateway;
        this.scanner = scanner;
        this.positionManager = positionManager;
        this.stats = stats;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.tickTimer = tickTimer;
    }

    // ═══════════════════════════════════════════════════════════════
    // STARTUP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Connection test before the loop: the gateway must report a balance and the reference venue
     * must price the first configured symbol.
     *
     * @throws IllegalStateException if the gateway or the quote source fails
     * @throws QuoteUnavailableException if the reference venue has no price for the symbol
     */
    public Balance preflight() {
        log.info("🔌 Testing connections...");

        Balance balance;
        try {
            balance = Futures.await(gateway.balance(), config.gatewayTimeout());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Gateway balance check failed: " + Futures.describe(e), e);
        }
        log.info("  ✓ Gateway ({}) balance: free=${} total=${}",
            gateway.mode(), balance.free().toPlainString(), balance.total().toPlainString());

        String probe = config.symbols().get(0);
        Optional<Quote> quote;
        try {
            quote = Futures.await(referenceSource.getQuote(probe), config.quoteFetchTimeout());
        } catch (RuntimeException e) {
            throw new IllegalStateException("Reference quote check failed: " + Futures.describe(e), e);
        }
        Quote q = quote.orElseThrow(() ->
            new QuoteUnavailableException(referenceSource.name(), probe, "preflight returned no price"));
        log.info("  ✓ {} {} = {}", referenceSource.name(), probe, q.price().toPlainString());

        return balance;
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Run ticks until {@link #requestStop()} or interruption, then shut down.
     * Blocks the calling thread.
     */
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already running");
        }
        startedAt = clock.instant();
        log.info("🚀 Trading loop started: {} symbols every {}ms ({} mode)",
            config.symbols().size(), config.tickInterval().toMillis(), gateway.mode());

        try {
            while (!tickTimer.isCancelled()) {
                try {
                    runTick();
                } catch (RuntimeException e) {
                    log.error("Tick {} failed: {}", ticks.get(), Futures.describe(e), e);
                }

                if (!tickTimer.await(config.tickInterval())) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Trading loop interrupted");
        } finally {
            shutdown();
        }
    }

    /**
     * Execute one tick.
     */
    public TickResult runTick() {
        Instant tickStart = clock.instant();
        long tickNo = ticks.incrementAndGet();
        List<String> symbols = config.symbols();

        // (a) quotes, both venues in parallel
        CompletableFuture<Map<String, Quote>> refFuture = fetch(referenceSource, symbols);
        CompletableFuture<Map<String, Quote>> cmpFuture = fetch(comparisonSource, symbols);
        CompletableFuture.allOf(refFuture, cmpFuture).join();
        Map<String, Quote> refQuotes = refFuture.join();
        Map<String, Quote> cmpQuotes = cmpFuture.join();

        // (b) scan
        List<Opportunity> opportunities = scanner.scan(refQuotes, cmpQuotes);
        stats.recordOpportunities(opportunities.size());
        for (Opportunity opp : opportunities) {
            metrics.recordOpportunity(opp.symbol());
            events.emit(EventType.OPPORTUNITY_DETECTED, opp.symbol(), opp);
            log.info("🔍 Opportunity {} {}: spread={}% ref={} cmp={}",
                opp.direction(), opp.symbol(), opp.spreadPercent().setScale(2, RoundingMode.HALF_UP).toPlainString(),
                opp.referencePrice().toPlainString(), opp.comparisonPrice().toPlainString());
        }

        // (c) entries, sequential in symbol order
        List<EntryDecision> entries = new ArrayList<>();
        for (Opportunity opp : opportunities) {
            entries.add(positionManager.considerEntry(opp));
        }

        // (d) exits
        List<CloseResult> exits = positionManager.evaluateAll(refQuotes, cmpQuotes, clock.instant());

        // (e) statistics
        Instant now = clock.instant();
        stats.onTick(LocalDate.ofInstant(now, clock.getZone()));
        stats.maybeLogSummary(now);

        Duration elapsed = Duration.between(tickStart, clock.instant());
        metrics.recordTick(elapsed);
        log.debug("Tick {} done in {}ms: ref={} cmp={} opportunities={} open={}",
            tickNo, elapsed.toMillis(), refQuotes.size(), cmpQuotes.size(),
            opportunities.size(), positionManager.openCount());

        return new TickResult(refQuotes.size(), cmpQuotes.size(), opportunities, entries, exits);
    }

    /**
     * Bounded fetch that never fails: a timeout or error yields an empty map for this source only.
     */
    private CompletableFuture<Map<String, Quote>> fetch(QuoteSource source, List<String> symbols) {
        Instant started = clock.instant();
        CompletableFuture<Map<String, Quote>> future;
        try {
            future = source.getQuotes(symbols);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future
            .orTimeout(config.quoteFetchTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle((quotes, error) -> {
                Map<String, Quote> result = quotes != null ? quotes : Map.of();
                if (error != null) {
                    log.warn("[{}] Quote fetch failed: {}", source.name(), Futures.describe(error));
                    result = Map.of();
                }
                metrics.recordQuoteFetch(source.name(), symbols.size(), result.size(),
                    Duration.between(started, clock.instant()));
                return result;
            });
    }

    // ═══════════════════════════════════════════════════════════════
    // SHUTDOWN
    // ═══════════════════════════════════════════════════════════════

    /**
     * Ask the loop to stop after the in-flight tick.
     */
    public void requestStop() {
        log.info("🛑 Stop requested");
        tickTimer.cancel();
    }

    /**
     * Close all positions, emit the session summary, release collaborators. Runs once.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        tickTimer.cancel();

        log.info("════════════════════════════════════════════════════════");
        log.info("Shutting down trading engine...");

        int open = positionManager.openCount();
        if (open > 0) {
            log.info("Closing {} open positions...", open);
            List<CloseResult> results = positionManager.closeAll(ExitReason.SHUTDOWN);
            long closed = results.stream().filter(CloseResult::isClosed).count();
            log.info("  ✓ Closed {}/{} positions", closed, open);
        }

        SessionStats s = stats.snapshot();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("startedAt", startedAt);
        summary.put("endedAt", clock.instant());
        summary.put("ticks", ticks.get());
        summary.put("stats", s);
        summary.put("winRate", s.winRate());
        summary.put("archivedDays", stats.history().size());
        summary.put("positionsLeftOpen", positionManager.openCount());
        events.emitSession(EventType.SESSION_SUMMARY, summary);
        stats.logSummary();

        closeQuietly("gateway", gateway);
        closeQuietly(referenceSource.name(), referenceSource);
        closeQuietly(comparisonSource.name(), comparisonSource);

        running.set(false);
        log.info("✅ Engine stopped after {} ticks", ticks.get());
        log.info("════════════════════════════════════════════════════════");
    }

    private void closeQuietly(String name, AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", name, e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════

    public EngineStatus status() {
        SessionStats s = stats.snapshot();
        return new EngineStatus(
            running.get(),
            gateway.mode(),
            referenceSource.name(),
            comparisonSource.name(),
            config.symbols(),
            startedAt,
            ticks.get(),
            positionManager.openPositions(),
            s,
            s.winRate());
    }

    public boolean isRunning() {
        return running.get();
    }
}
