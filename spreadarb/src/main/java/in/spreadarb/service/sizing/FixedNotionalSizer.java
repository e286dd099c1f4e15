package in.spreadarb.service.sizing;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Fixed USD notional per entry. Also requires enough free balance to post the margin
 * ({@code notional / leverage}).
 */
public final class FixedNotionalSizer implements PositionSizer {
    private final BigDecimal notionalUsd;
    private final BigDecimal leverage;

    public FixedNotionalSizer(BigDecimal notionalUsd, BigDecimal leverage) {
        this.notionalUsd = notionalUsd;
        this.leverage = leverage;
    }

    @Override
    public SizingResult size(String symbol, BigDecimal referencePrice, BigDecimal freeBalance) {
        BigDecimal margin = notionalUsd.divide(leverage, MathContext.DECIMAL64);
        if (freeBalance.compareTo(margin) < 0) {
            return SizingResult.rejected("margin " + margin.toPlainString()
                + " exceeds free balance " + freeBalance.toPlainString());
        }
        return SizingResult.of(PositionSizer.unitsFor(notionalUsd, referencePrice), notionalUsd);
    }
}
