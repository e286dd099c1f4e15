package in.spreadarb.infrastructure.venue;

/**
 * Exception thrown when the order gateway refuses or fails an open/close request.
 */
public class GatewayRejectedException extends RuntimeException {

    private final String venue;
    private final String symbol;
    private final String operation;

    public GatewayRejectedException(String venue, String symbol, String operation, String message) {
        super(String.format("[%s] %s rejected for %s: %s", venue, operation, symbol, message));
        this.venue = venue;
        this.symbol = symbol;
        this.operation = operation;
    }

    public GatewayRejectedException(String venue, String symbol, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s rejected for %s: %s", venue, operation, symbol, message), cause);
        this.venue = venue;
        this.symbol = symbol;
        this.operation = operation;
    }

    public String getVenue() {
        return venue;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getOperation() {
        return operation;
    }
}
