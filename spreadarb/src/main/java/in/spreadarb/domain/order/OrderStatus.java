package in.spreadarb.domain.order;

/**
 * Order status enum.
 */
public enum OrderStatus {
    PLACED,     // Accepted by the venue, fill not yet confirmed
    FILLED,     // Completely filled
    REJECTED    // Rejected by the venue
}
