package in.spreadarb.config;

import java.math.BigDecimal;

/**
 * Sizing policy parameters.
 *
 * FIXED_NOTIONAL uses {@code notionalUsd}; RISK_FRACTION uses {@code riskFraction} and
 * {@code maxNotionalUsd}. Unused fields are null.
 */
public record SizingPolicy(
    SizingPolicyType type,
    BigDecimal notionalUsd,
    BigDecimal riskFraction,     // 0.10 = 10% of free balance
    BigDecimal maxNotionalUsd
) {
    public static SizingPolicy fixedNotional(BigDecimal notionalUsd) {
        return new SizingPolicy(SizingPolicyType.FIXED_NOTIONAL, notionalUsd, null, null);
    }

    public static SizingPolicy riskFraction(BigDecimal riskFraction, BigDecimal maxNotionalUsd) {
        return new SizingPolicy(SizingPolicyType.RISK_FRACTION, null, riskFraction, maxNotionalUsd);
    }

    public boolean isFixedNotional() {
        return type == SizingPolicyType.FIXED_NOTIONAL;
    }
}
