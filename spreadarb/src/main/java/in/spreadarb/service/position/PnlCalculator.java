package in.spreadarb.service.position;

import in.spreadarb.config.RiskLimits;
import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.Position;
import in.spreadarb.domain.trade.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Leverage-adjusted realized PnL.
 *
 * <pre>
 * LONG  gross = (exit − entry) × size × leverage
 * SHORT gross = (entry − exit) × size × leverage
 * fees        = entry × size × feeRate × 2      (open + close, charged on entry notional)
 * pnl         = gross − fees
 * </pre>
 */
public final class PnlCalculator {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final BigDecimal leverage;
    private final BigDecimal feeRate;

    public PnlCalculator(BigDecimal leverage, BigDecimal feeRate) {
        this.leverage = leverage;
        this.feeRate = feeRate;
    }

    public PnlCalculator(RiskLimits risk) {
        this(risk.leverageDecimal(), risk.feeRate());
    }

    public BigDecimal grossPnl(Position position, BigDecimal exitPrice) {
        BigDecimal move = position.side() == Side.LONG
            ? exitPrice.subtract(position.entryPrice())
            : position.entryPrice().subtract(exitPrice);
        return move.multiply(position.size()).multiply(leverage);
    }

    public BigDecimal fees(Position position) {
        return position.entryPrice().multiply(position.size()).multiply(feeRate).multiply(TWO);
    }

    public ClosedTrade realize(Position position, BigDecimal exitPrice, Instant exitTime, ExitReason reason) {
        BigDecimal gross = grossPnl(position, exitPrice);
        BigDecimal fees = fees(position);
        return new ClosedTrade(position, exitPrice, exitTime, reason, gross, fees, gross.subtract(fees));
    }
}
