package in.spreadarb.service.stats;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.monitoring.DailyPerformance;
import in.spreadarb.domain.monitoring.SessionStats;
import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.service.event.TradeEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cumulative and daily trading counters.
 *
 * Counters move on open (trade counts) and on close (PnL, wins). Daily fields reset when the
 * calendar date changes; the finished day is archived first as a {@link DailyPerformance}.
 *
 * Written from the scheduler thread, read by the status endpoint, hence synchronized.
 */
public final class StatisticsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

    private final BigDecimal maxDailyLoss;
    private final Duration statsLogInterval;
    private final TradeEventPublisher events;
    private final EngineMetrics metrics;

    // Cumulative
    private int totalTrades = 0;
    private int winningTrades = 0;
    private int closedTrades = 0;
    private BigDecimal totalPnl = BigDecimal.ZERO;
    private long opportunitiesFound = 0;

    // Current day
    private LocalDate lastResetDate;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private int dailyTradeCount = 0;
    private int dailyClosed = 0;
    private int dailyWinners = 0;
    private BigDecimal bestTrade;
    private BigDecimal worstTrade;

    private Instant lastSummaryAt;
    private final List<DailyPerformance> history = new ArrayList<>();

    public StatisticsAggregator(ArbitrageConfig config, LocalDate startDate,
                                TradeEventPublisher events, EngineMetrics metrics) {
        this.maxDailyLoss = config.risk().maxDailyLoss();
        this.statsLogInterval = config.statsLogInterval();
        this.events = events;
        this.metrics = metrics;
        this.lastResetDate = startDate;
    }

    public synchronized void recordOpen(Position position) {
        totalTrades++;
        dailyTradeCount++;
    }

    public synchronized void recordClose(ClosedTrade trade) {
        BigDecimal pnl = trade.pnl();
        totalPnl = totalPnl.add(pnl);
        dailyPnl = dailyPnl.add(pnl);
        closedTrades++;
        dailyClosed++;
        if (trade.isWinner()) {
            winningTrades++;
            dailyWinners++;
        }
        bestTrade = bestTrade == null ? pnl : bestTrade.max(pnl);
        worstTrade = worstTrade == null ? pnl : worstTrade.min(pnl);

        metrics.updateSessionPnl(totalPnl, dailyPnl);
    }

    public synchronized void recordOpportunities(int count) {
        opportunitiesFound += count;
    }

    /**
     * Roll the daily counters when {@code today} differs from the last reset date.
     *
     * @return the archived day, present exactly once per date change
     */
    public Optional<DailyPerformance> onTick(LocalDate today) {
        DailyPerformance archived;
        synchronized (this) {
            if (today.equals(lastResetDate)) {
                return Optional.empty();
            }

            archived = new DailyPerformance(
                lastResetDate,
                dailyTradeCount,
                dailyClosed,
                dailyWinners,
                dailyClosed - dailyWinners,
                dailyPnl,
                bestTrade != null ? bestTrade : BigDecimal.ZERO,
                worstTrade != null ? worstTrade : BigDecimal.ZERO);
            history.add(archived);

            dailyPnl = BigDecimal.ZERO;
            dailyTradeCount = 0;
            dailyClosed = 0;
            dailyWinners = 0;
            bestTrade = null;
            worstTrade = null;
            lastResetDate = today;

            metrics.updateSessionPnl(totalPnl, dailyPnl);
        }

        log.info("📅 Daily rollover {} → {}: trades={}, closed={}, pnl=${}",
            archived.getTradeDate(), today, archived.getTradesOpened(), archived.getTradesClosed(),
            archived.getTotalPnl().toPlainString());
        events.emitSession(EventType.DAILY_ROLLOVER, archived);
        return Optional.of(archived);
    }

    /**
     * True once today's realized loss reaches the configured limit. A non-positive limit disables the check.
     */
    public synchronized boolean isDailyLossLimitReached() {
        return maxDailyLoss.signum() > 0 && dailyPnl.compareTo(maxDailyLoss.negate()) <= 0;
    }

    /**
     * Log the summary if {@code statsLogInterval} has passed since the last one.
     */
    public void maybeLogSummary(Instant now) {
        synchronized (this) {
            if (lastSummaryAt == null) {
                lastSummaryAt = now;
                return;
            }
            if (Duration.between(lastSummaryAt, now).compareTo(statsLogInterval) < 0) {
                return;
            }
            lastSummaryAt = now;
        }
        logSummary();
    }

    public void logSummary() {
        SessionStats s = snapshot();
        log.info("📊 Stats: trades={} closed={} winRate={}% totalPnl=${} dailyPnl=${} dailyTrades={} opportunities={}",
            s.totalTrades(), s.closedTrades(), String.format("%.1f", s.winRate()),
            s.totalPnl().toPlainString(), s.dailyPnl().toPlainString(), s.dailyTradeCount(), s.opportunitiesFound());
    }

    public synchronized SessionStats snapshot() {
        return new SessionStats(totalTrades, winningTrades, closedTrades, totalPnl, dailyPnl,
            dailyTradeCount, lastResetDate, opportunitiesFound);
    }

    /**
     * Archived days, oldest first.
     */
    public synchronized List<DailyPerformance> history() {
        return List.copyOf(history);
    }
}
