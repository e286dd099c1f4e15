package in.spreadarb.domain.trade;

/**
 * Why a position was closed. Declaration order of the first five is the evaluation priority.
 */
public enum ExitReason {
    QUOTE_UNAVAILABLE,  // A quote was missing or stale: unknown state forces exit
    TARGET_SPREAD,      // Spread converged to the target
    STOP_LOSS,          // Reference price crossed the stop
    TAKE_PROFIT,        // Reference price reached the take-profit level
    MAX_HOLD_TIME,      // Held longer than allowed
    SHUTDOWN            // Engine stopping
}
