package in.spreadarb.service.sizing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Strategy that turns free balance and a reference price into an order size.
 */
public interface PositionSizer {

    SizingResult size(String symbol, BigDecimal referencePrice, BigDecimal freeBalance);

    /**
     * Quantity precision used by the venue: 3 decimals for sizes above one unit, 6 below.
     * Always rounds down so the notional never exceeds the budget.
     */
    static BigDecimal roundQuantity(BigDecimal rawSize) {
        int scale = rawSize.compareTo(BigDecimal.ONE) > 0 ? 3 : 6;
        return rawSize.setScale(scale, RoundingMode.DOWN);
    }

    static BigDecimal unitsFor(BigDecimal notionalUsd, BigDecimal price) {
        return roundQuantity(notionalUsd.divide(price, MathContext.DECIMAL64));
    }
}
