package in.spreadarb.service.position;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.config.RiskLimits;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.order.Balance;
import in.spreadarb.domain.order.OrderFill;
import in.spreadarb.domain.signal.Opportunity;
import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.domain.trade.PositionStatus;
import in.spreadarb.domain.trade.Side;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.infrastructure.venue.GatewayRejectedException;
import in.spreadarb.infrastructure.venue.InsufficientBalanceException;
import in.spreadarb.infrastructure.venue.OrderGateway;
import in.spreadarb.infrastructure.venue.QuoteSource;
import in.spreadarb.service.event.TradeEventPublisher;
import in.spreadarb.service.sizing.PositionSizer;
import in.spreadarb.service.sizing.SizingResult;
import in.spreadarb.service.stats.StatisticsAggregator;
import in.spreadarb.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the open-position set.
 *
 * Only this class calls the gateway's open/close. Every mutation of a symbol happens under that
 * symbol's lock; a symbol whose lock is already held is skipped rather than waited on.
 *
 * Lifecycle: OPEN → CLOSING → CLOSED (removed), or CLOSING → OPEN when the gateway refuses the close.
 */
public final class PositionManager {
    private static final Logger log = LoggerFactory.getLogger(PositionManager.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskLimits risk;
    private final BigDecimal targetSpreadPercent;
    private final Duration gatewayTimeout;
    private final OrderGateway gateway;
    private final QuoteSource referenceSource;
    private final PositionSizer sizer;
    private final ExitRuleEvaluator exitRules;
    private final PnlCalculator pnlCalculator;
    private final StatisticsAggregator stats;
    private final TradeEventPublisher events;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final ConcurrentHashMap<String, Position> positions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    public PositionManager(ArbitrageConfig config,
                           OrderGateway gateway,
                           QuoteSource referenceSource,
                           PositionSizer sizer,
                           StatisticsAggregator stats,
                           TradeEventPublisher events,
                           EngineMetrics metrics,
                           Clock clock) {
        this.risk = config.risk();
        this.targetSpreadPercent = config.targetSpreadPercent();
        this.gatewayTimeout = config.gatewayTimeout();
        this.gateway = gateway;
        this.referenceSource = referenceSource;
        this.sizer = sizer;
        this.exitRules = new ExitRuleEvaluator(risk.maxQuoteAge(), risk.maxHoldDuration());
        this.pnlCalculator = new PnlCalculator(risk);
        this.stats = stats;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // ENTRY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Admit or reject one opportunity. Never throws; failures before the fill become rejections.
     */
    public EntryDecision considerEntry(Opportunity opportunity) {
        String symbol = opportunity.symbol();
        ReentrantLock lock = lockFor(symbol);
        EntryDecision decision;

        if (!lock.tryLock()) {
            decision = EntryDecision.rejected(symbol, EntryDecision.Outcome.SYMBOL_BUSY, "mutation in flight");
        } else {
            try {
                decision = admit(opportunity);
            } catch (RuntimeException e) {
                log.error("Entry failed for {}: {}", symbol, Futures.describe(e), e);
                decision = EntryDecision.rejected(symbol, EntryDecision.Outcome.GATEWAY_REJECTED, Futures.describe(e));
            } finally {
                lock.unlock();
            }
        }

        metrics.recordEntryDecision(symbol, decision.outcome().name());
        if (!decision.isOpened()) {
            log.debug("Entry skipped for {}: {} {}", symbol, decision.outcome(),
                decision.detail() != null ? "(" + decision.detail() + ")" : "");
        }
        return decision;
    }

    private EntryDecision admit(Opportunity opportunity) {
        String symbol = opportunity.symbol();

        if (positions.containsKey(symbol)) {
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.ALREADY_OPEN, null);
        }
        if (positions.size() >= risk.maxPositions()) {
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.MAX_POSITIONS,
                positions.size() + "/" + risk.maxPositions() + " open");
        }
        if (stats.isDailyLossLimitReached()) {
            log.warn("⚠️ Daily loss limit ${} reached, skipping {}", risk.maxDailyLoss().toPlainString(), symbol);
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.DAILY_LOSS_LIMIT, null);
        }

        Balance balance;
        Instant started = clock.instant();
        try {
            balance = Futures.await(gateway.balance(), gatewayTimeout);
            metrics.recordGatewayCall("balance", true, Duration.between(started, clock.instant()));
        } catch (RuntimeException e) {
            metrics.recordGatewayCall("balance", false, Duration.between(started, clock.instant()));
            log.warn("Balance unavailable, skipping {}: {}", symbol, Futures.describe(e));
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.BALANCE_UNAVAILABLE, Futures.describe(e));
        }

        if (balance.free().compareTo(risk.minFreeBalance()) < 0) {
            InsufficientBalanceException e =
                new InsufficientBalanceException(symbol, balance.free(), risk.minFreeBalance());
            log.warn("⚠️ {}", e.getMessage());
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.INSUFFICIENT_BALANCE, e.getMessage());
        }

        SizingResult sizing = sizer.size(symbol, opportunity.referencePrice(), balance.free());
        if (!sizing.isTradable()) {
            log.warn("Sizing rejected {}: {}", symbol, sizing.rejection());
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.SIZE_REJECTED, sizing.rejection());
        }

        Side side = opportunity.direction();
        OrderFill fill;
        started = clock.instant();
        try {
            fill = Futures.await(gateway.open(symbol, side, sizing.size()), gatewayTimeout);
            if (fill == null || !fill.isAccepted()) {
                throw new GatewayRejectedException(gateway.mode().name(), symbol, "open",
                    fill != null ? fill.statusMessage() : "no fill");
            }
            metrics.recordGatewayCall("open", true, Duration.between(started, clock.instant()));
        } catch (RuntimeException e) {
            metrics.recordGatewayCall("open", false, Duration.between(started, clock.instant()));
            log.error("❌ Open {} {} failed: {}", side, symbol, Futures.describe(e));
            return EntryDecision.rejected(symbol, EntryDecision.Outcome.GATEWAY_REJECTED, Futures.describe(e));
        }

        BigDecimal entryPrice = fill.hasFillPrice() ? fill.fillPrice() : opportunity.referencePrice();
        BigDecimal size = fill.size() != null && fill.size().signum() > 0 ? fill.size() : sizing.size();

        Position position = new Position(
            symbol,
            side,
            size,
            entryPrice,
            opportunity.spreadPercent(),
            clock.instant(),
            targetSpreadPercent,
            stopLossPrice(side, entryPrice),
            takeProfitPrice(side, entryPrice),
            PositionStatus.OPEN,
            fill.orderId());

        positions.put(symbol, position);
        // Live at the venue from here on; failures below are logged only.
        try {
            stats.recordOpen(position);
            metrics.updateOpenPositions(positions.size());
            events.emit(EventType.POSITION_OPENED, symbol, position);
        } catch (RuntimeException e) {
            log.warn("⚠️ {} opened but post-open bookkeeping failed: {}", symbol, Futures.describe(e), e);
        }

        log.info("✅ OPENED {} {} size={} @ {} spread={}% stop={} take={} ({} order {})",
            side, symbol, size.toPlainString(), entryPrice.toPlainString(),
            opportunity.spreadPercent().setScale(2, RoundingMode.HALF_UP).toPlainString(),
            position.stopLossPrice().toPlainString(), position.takeProfitPrice().toPlainString(),
            gateway.mode(), fill.orderId());

        return EntryDecision.opened(position);
    }

    BigDecimal stopLossPrice(Side side, BigDecimal entryPrice) {
        BigDecimal pct = risk.stopLossPercent().divide(HUNDRED, MathContext.DECIMAL64);
        return side == Side.LONG
            ? entryPrice.multiply(BigDecimal.ONE.subtract(pct))
            : entryPrice.multiply(BigDecimal.ONE.add(pct));
    }

    BigDecimal takeProfitPrice(Side side, BigDecimal entryPrice) {
        BigDecimal pct = risk.takeProfitPercent().divide(HUNDRED, MathContext.DECIMAL64);
        return side == Side.LONG
            ? entryPrice.multiply(BigDecimal.ONE.add(pct))
            : entryPrice.multiply(BigDecimal.ONE.subtract(pct));
    }

    // ═══════════════════════════════════════════════════════════════
    // EXIT EVALUATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Apply the exit rules to one position and close it if any rule matches.
     * With no match nothing changes and the gateway is not called.
     *
     * @return the close result, empty when the position stays open
     */
    public Optional<CloseResult> evaluate(Position position, Quote referenceQuote, Quote comparisonQuote, Instant now) {
        Position current = positions.get(position.symbol());
        if (current == null || !current.isOpen()) {
            return Optional.empty();
        }

        Optional<ExitReason> reason = exitRules.evaluate(current, referenceQuote, comparisonQuote, now);
        if (reason.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal hint = referenceQuote != null && !referenceQuote.isStale(now, risk.maxQuoteAge())
            ? referenceQuote.price()
            : null;
        log.info("🎯 Exit signal {} for {}", reason.get(), current.symbol());
        return Optional.of(close(current.symbol(), reason.get(), hint));
    }

    /**
     * Evaluate every open position against this tick's quotes. One symbol's failure does not
     * affect the others.
     */
    public List<CloseResult> evaluateAll(Map<String, Quote> referenceQuotes,
                                         Map<String, Quote> comparisonQuotes,
                                         Instant now) {
        List<CloseResult> results = new ArrayList<>();
        for (Position position : openPositions()) {
            String symbol = position.symbol();
            try {
                evaluate(position, referenceQuotes.get(symbol), comparisonQuotes.get(symbol), now)
                    .ifPresent(results::add);
            } catch (RuntimeException e) {
                log.error("Exit evaluation failed for {}: {}", symbol, Futures.describe(e), e);
            }
        }
        return results;
    }

    // ═══════════════════════════════════════════════════════════════
    // CLOSE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close an open position through the gateway.
     *
     * Exit price: the fill price, else {@code exitPriceHint}, else a fresh reference quote,
     * else the entry price. On gateway failure the position is put back OPEN unchanged.
     *
     * @param exitPriceHint this tick's reference price, may be null
     */
    public CloseResult close(String symbol, ExitReason reason, BigDecimal exitPriceHint) {
        ReentrantLock lock = lockFor(symbol);
        if (!lock.tryLock()) {
            return new CloseResult(symbol, reason, CloseResult.Outcome.SYMBOL_BUSY, null, "mutation in flight");
        }

        try {
            Position current = positions.get(symbol);
            if (current == null || !current.isOpen()) {
                return new CloseResult(symbol, reason, CloseResult.Outcome.NOT_OPEN, null, null);
            }

            Position closing = current.withStatus(PositionStatus.CLOSING);
            positions.put(symbol, closing);

            OrderFill fill;
            Instant started = clock.instant();
            try {
                fill = Futures.await(gateway.close(symbol), gatewayTimeout);
                if (fill == null || !fill.isAccepted()) {
                    throw new GatewayRejectedException(gateway.mode().name(), symbol, "close",
                        fill != null ? fill.statusMessage() : "no fill");
                }
                metrics.recordGatewayCall("close", true, Duration.between(started, clock.instant()));
            } catch (RuntimeException e) {
                metrics.recordGatewayCall("close", false, Duration.between(started, clock.instant()));
                return closeFailed(current, reason, e);
            }

            BigDecimal exitPrice = resolveExitPrice(current, fill, exitPriceHint);
            Position closed = closing.withStatus(PositionStatus.CLOSED);
            ClosedTrade trade = pnlCalculator.realize(closed, exitPrice, clock.instant(), reason);

            positions.remove(symbol);
            stats.recordClose(trade);
            metrics.recordExit(symbol, reason, trade.pnl());
            metrics.updateOpenPositions(positions.size());
            events.emit(EventType.POSITION_CLOSED, symbol, trade);

            log.info("{} CLOSED {} {} @ {} reason={} pnl=${} (gross={} fees={})",
                trade.isWinner() ? "💰" : "📉",
                closed.side(), symbol, exitPrice.toPlainString(), reason,
                trade.pnl().setScale(4, RoundingMode.HALF_UP).toPlainString(),
                trade.grossPnl().toPlainString(), trade.fees().toPlainString());

            return new CloseResult(symbol, reason, CloseResult.Outcome.CLOSED, trade, null);

        } finally {
            lock.unlock();
        }
    }

    /**
     * Close every open position. Positions the gateway refuses to close stay tracked.
     */
    public List<CloseResult> closeAll(ExitReason reason) {
        List<CloseResult> results = new ArrayList<>();
        for (Position position : openPositions()) {
            try {
                results.add(close(position.symbol(), reason, null));
            } catch (RuntimeException e) {
                log.error("Close-all failed for {}: {}", position.symbol(), Futures.describe(e), e);
            }
        }

        long stillOpen = positions.size();
        if (stillOpen > 0) {
            log.warn("⚠️ {} positions still open after close-all: {}", stillOpen, positions.keySet());
        }
        return results;
    }

    private CloseResult closeFailed(Position original, ExitReason reason, RuntimeException e) {
        String symbol = original.symbol();
        positions.put(symbol, original);
        metrics.recordCloseFailure(symbol);

        String error = Futures.describe(e);
        log.error("❌ Close {} ({}) failed, keeping position open for retry: {}", symbol, reason, error);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.name());
        payload.put("error", error);
        payload.put("side", original.side().name());
        payload.put("size", original.size());
        payload.put("entryPrice", original.entryPrice());
        events.emit(EventType.POSITION_CLOSE_FAILED, symbol, payload);

        return new CloseResult(symbol, reason, CloseResult.Outcome.FAILED, null, error);
    }

    private BigDecimal resolveExitPrice(Position position, OrderFill fill, BigDecimal hint) {
        if (fill.hasFillPrice()) {
            return fill.fillPrice();
        }
        if (hint != null && hint.signum() > 0) {
            return hint;
        }

        String symbol = position.symbol();
        try {
            Optional<Quote> quote = Futures.await(referenceSource.getQuote(symbol), gatewayTimeout);
            if (quote.isPresent()) {
                return quote.get().price();
            }
        } catch (RuntimeException e) {
            log.warn("Exit quote lookup failed for {}: {}", symbol, Futures.describe(e));
        }

        log.warn("⚠️ No exit price for {}, booking at entry price {}", symbol, position.entryPrice().toPlainString());
        return position.entryPrice();
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Snapshot of tracked positions (OPEN or CLOSING).
     */
    public List<Position> openPositions() {
        return List.copyOf(positions.values());
    }

    public Optional<Position> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public int openCount() {
        return positions.size();
    }

    private ReentrantLock lockFor(String symbol) {
        return symbolLocks.computeIfAbsent(symbol, k -> new ReentrantLock());
    }
}
