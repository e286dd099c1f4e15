package in.spreadarb.service.sizing;

import in.spreadarb.config.RiskLimits;
import in.spreadarb.config.SizingPolicy;

/**
 * Factory for the configured sizing strategy.
 */
public final class PositionSizers {
    private PositionSizers() {}

    public static PositionSizer from(RiskLimits risk) {
        SizingPolicy policy = risk.sizing();
        return switch (policy.type()) {
            case FIXED_NOTIONAL -> new FixedNotionalSizer(policy.notionalUsd(), risk.leverageDecimal());
            case RISK_FRACTION -> new RiskFractionSizer(policy.riskFraction(), policy.maxNotionalUsd());
        };
    }
}
