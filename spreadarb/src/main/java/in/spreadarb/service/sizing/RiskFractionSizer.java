package in.spreadarb.service.sizing;

import java.math.BigDecimal;

/**
 * Risk a fraction of free balance per entry, capped at a maximum notional.
 */
public final class RiskFractionSizer implements PositionSizer {
    private final BigDecimal riskFraction;
    private final BigDecimal maxNotionalUsd;

    public RiskFractionSizer(BigDecimal riskFraction, BigDecimal maxNotionalUsd) {
        this.riskFraction = riskFraction;
        this.maxNotionalUsd = maxNotionalUsd;
    }

    @Override
    public SizingResult size(String symbol, BigDecimal referencePrice, BigDecimal freeBalance) {
        BigDecimal notional = maxNotionalUsd.min(freeBalance.multiply(riskFraction));
        if (notional.signum() <= 0) {
            return SizingResult.rejected("no balance to risk");
        }
        return SizingResult.of(PositionSizer.unitsFor(notional, referencePrice), notional);
    }
}
