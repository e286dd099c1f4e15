package in.spreadarb.domain.monitoring;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Point-in-time copy of the session counters.
 */
public record SessionStats(
    int totalTrades,
    int winningTrades,
    int closedTrades,
    BigDecimal totalPnl,
    BigDecimal dailyPnl,
    int dailyTradeCount,
    LocalDate lastResetDate,
    long opportunitiesFound
) {
    /**
     * winningTrades / totalTrades × 100, or 0 with no trades.
     */
    public double winRate() {
        return totalTrades > 0 ? winningTrades * 100.0 / totalTrades : 0.0;
    }
}
