package in.spreadarb.service.position;

import in.spreadarb.domain.trade.ClosedTrade;
import in.spreadarb.domain.trade.ExitReason;

/**
 * Result of a close attempt. {@code trade} is set only when the outcome is CLOSED.
 */
public record CloseResult(String symbol, ExitReason reason, Outcome outcome, ClosedTrade trade, String detail) {

    public enum Outcome {
        CLOSED,
        FAILED,       // gateway refused; position kept OPEN for the next tick
        NOT_OPEN,
        SYMBOL_BUSY
    }

    public boolean isClosed() {
        return outcome == Outcome.CLOSED;
    }
}
