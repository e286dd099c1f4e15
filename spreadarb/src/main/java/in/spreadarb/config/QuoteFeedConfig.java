package in.spreadarb.config;

import java.time.Duration;

/**
 * Public ticker endpoint for one venue.
 *
 * The URL template may contain {symbol} (base and quote joined by {@code symbolSeparator}),
 * {base} and {quote}. The price is read from the response with a JSON pointer.
 */
public record QuoteFeedConfig(
    String name,
    String urlTemplate,
    String pricePointer,
    String symbolSeparator,
    Duration cacheTtl
) {
    /**
     * Render the request URL for a symbol such as "BTC/USDT".
     */
    public String urlFor(String symbol) {
        String[] parts = symbol.split("/", 2);
        String base = parts[0];
        String quote = parts.length > 1 ? parts[1] : "";
        String venueSymbol = quote.isEmpty() ? base : base + symbolSeparator + quote;
        return urlTemplate
            .replace("{symbol}", venueSymbol)
            .replace("{base}", base)
            .replace("{quote}", quote);
    }
}
