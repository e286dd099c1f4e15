package in.spreadarb.domain.trade;

/**
 * Position lifecycle.
 *
 * OPEN → CLOSING → CLOSED. A failed close returns CLOSING → OPEN so the position is retried.
 */
public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(PositionStatus next) {
        return switch (this) {
            case OPEN -> next == CLOSING;
            case CLOSING -> next == CLOSED || next == OPEN;
            case CLOSED -> false;
        };
    }
}
