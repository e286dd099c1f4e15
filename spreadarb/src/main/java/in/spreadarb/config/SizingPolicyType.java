package in.spreadarb.config;

/**
 * How the notional of a new position is chosen.
 */
public enum SizingPolicyType {
    FIXED_NOTIONAL,  // Same USD notional for every entry
    RISK_FRACTION    // Fraction of free balance, capped by a maximum notional
}
