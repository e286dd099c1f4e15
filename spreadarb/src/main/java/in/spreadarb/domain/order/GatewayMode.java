package in.spreadarb.domain.order;

/**
 * Order gateway mode. Fixed when the gateway is constructed; never changes during a run.
 */
public enum GatewayMode {
    /**
     * Simulated fills at the current reference quote. No real orders, no settlement.
     */
    TEST,

    /**
     * Real orders on the reference venue.
     */
    LIVE;

    public static GatewayMode fromTestFlag(boolean testMode) {
        return testMode ? TEST : LIVE;
    }
}
