package in.spreadarb.domain.monitoring;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Archived totals of one calendar day, produced when the date rolls over.
 */
public class DailyPerformance {
    private final LocalDate tradeDate;
    private final int tradesOpened;
    private final int tradesClosed;
    private final int winningTrades;
    private final int losingTrades;
    private final double winRatePercent;
    private final BigDecimal totalPnl;
    private final BigDecimal bestTrade;
    private final BigDecimal worstTrade;

    public DailyPerformance(
            LocalDate tradeDate,
            int tradesOpened,
            int tradesClosed,
            int winningTrades,
            int losingTrades,
            BigDecimal totalPnl,
            BigDecimal bestTrade,
            BigDecimal worstTrade) {
        this.tradeDate = tradeDate;
        this.tradesOpened = tradesOpened;
        this.tradesClosed = tradesClosed;
        this.winningTrades = winningTrades;
        this.losingTrades = losingTrades;
        this.winRatePercent = tradesClosed > 0 ? winningTrades * 100.0 / tradesClosed : 0.0;
        this.totalPnl = totalPnl;
        this.bestTrade = bestTrade;
        this.worstTrade = worstTrade;
    }

    // Getters
    public LocalDate getTradeDate() { return tradeDate; }
    public int getTradesOpened() { return tradesOpened; }
    public int getTradesClosed() { return tradesClosed; }
    public int getWinningTrades() { return winningTrades; }
    public int getLosingTrades() { return losingTrades; }
    public double getWinRatePercent() { return winRatePercent; }
    public BigDecimal getTotalPnl() { return totalPnl; }
    public BigDecimal getBestTrade() { return bestTrade; }
    public BigDecimal getWorstTrade() { return worstTrade; }
}
