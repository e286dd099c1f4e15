package in.spreadarb.infrastructure.venue;

/**
 * Exception thrown when a quote source cannot produce a price for a symbol.
 */
public class QuoteUnavailableException extends RuntimeException {

    private final String venue;
    private final String symbol;

    public QuoteUnavailableException(String venue, String symbol, String message) {
        super(String.format("[%s] No quote for %s: %s", venue, symbol, message));
        this.venue = venue;
        this.symbol = symbol;
    }

    public QuoteUnavailableException(String venue, String symbol, String message, Throwable cause) {
        super(String.format("[%s] No quote for %s: %s", venue, symbol, message), cause);
        this.venue = venue;
        this.symbol = symbol;
    }

    public String getVenue() {
        return venue;
    }

    public String getSymbol() {
        return symbol;
    }
}
