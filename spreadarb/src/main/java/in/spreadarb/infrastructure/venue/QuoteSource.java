package in.spreadarb.infrastructure.venue;

import in.spreadarb.domain.market.Quote;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Price feed for one venue.
 *
 * Implementations must not throw synchronously; failures surface as exceptional completion
 * or as symbols missing from the returned map.
 */
public interface QuoteSource extends AutoCloseable {

    /**
     * Venue name used in logs and metrics labels.
     */
    String name();

    /**
     * Fetch current quotes for the given symbols.
     *
     * @return map of symbol to quote; symbols the venue could not price are absent
     */
    CompletableFuture<Map<String, Quote>> getQuotes(List<String> symbols);

    /**
     * Fetch a single quote.
     */
    CompletableFuture<Optional<Quote>> getQuote(String symbol);

    /**
     * Release HTTP clients, executors etc.
     */
    @Override
    void close();
}
