package in.spreadarb.service.position;

import in.spreadarb.domain.trade.Position;

/**
 * Result of one entry attempt. {@code position} is set only when the outcome is OPENED.
 */
public record EntryDecision(String symbol, Outcome outcome, Position position, String detail) {

    public enum Outcome {
        OPENED,
        ALREADY_OPEN,
        MAX_POSITIONS,
        DAILY_LOSS_LIMIT,
        BALANCE_UNAVAILABLE,
        INSUFFICIENT_BALANCE,
        SIZE_REJECTED,
        GATEWAY_REJECTED,
        SYMBOL_BUSY
    }

    public static EntryDecision opened(Position position) {
        return new EntryDecision(position.symbol(), Outcome.OPENED, position, null);
    }

    public static EntryDecision rejected(String symbol, Outcome outcome, String detail) {
        return new EntryDecision(symbol, outcome, null, detail);
    }

    public boolean isOpened() {
        return outcome == Outcome.OPENED;
    }
}
