package in.spreadarb.config;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Risk limits for the run. Immutable; injected into the position manager and sizers.
 */
public record RiskLimits(
    int maxPositions,
    SizingPolicy sizing,
    int leverage,
    BigDecimal stopLossPercent,     // 2.0 = 2%
    BigDecimal takeProfitPercent,   // 4.0 = 4%
    Duration maxHoldDuration,
    BigDecimal feeRate,             // per side, 0.0002 = 0.02%
    BigDecimal minFreeBalance,      // USD below which no entry is attempted
    BigDecimal maxDailyLoss,        // USD, entries stop once daily PnL reaches -maxDailyLoss
    Duration maxQuoteAge
) {
    public static RiskLimits defaults() {
        return new RiskLimits(
            3,
            SizingPolicy.riskFraction(new BigDecimal("0.10"), new BigDecimal("100")),
            2,
            new BigDecimal("2.0"),
            new BigDecimal("4.0"),
            Duration.ofHours(1),
            new BigDecimal("0.0002"),
            new BigDecimal("10"),
            new BigDecimal("50"),
            Duration.ofSeconds(30)
        );
    }

    public BigDecimal leverageDecimal() {
        return BigDecimal.valueOf(leverage);
    }
}
