package in.spreadarb.domain.trade;

/**
 * Side of a position on the reference venue.
 */
public enum Side {
    LONG,   // bought on the reference venue (cheaper there)
    SHORT;  // sold on the reference venue (dearer there)

    /**
     * Order action that opens this side.
     */
    public String openAction() {
        return this == LONG ? "buy" : "sell";
    }

    /**
     * Order action that closes this side.
     */
    public String closeAction() {
        return this == LONG ? "sell" : "buy";
    }
}
