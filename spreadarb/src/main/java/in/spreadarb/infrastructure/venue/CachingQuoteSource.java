package in.spreadarb.infrastructure.venue;

import in.spreadarb.domain.market.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-TTL cache in front of another quote source.
 *
 * Quotes younger than the TTL are served from memory; only the remaining symbols go to the
 * delegate. A zero TTL disables caching.
 */
public final class CachingQuoteSource implements QuoteSource {
    private static final Logger log = LoggerFactory.getLogger(CachingQuoteSource.class);

    private final QuoteSource delegate;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, CachedQuote> cache = new ConcurrentHashMap<>();

    public CachingQuoteSource(QuoteSource delegate, Duration ttl, Clock clock) {
        this.delegate = delegate;
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public CompletableFuture<Map<String, Quote>> getQuotes(List<String> symbols) {
        Instant now = clock.instant();
        Map<String, Quote> hits = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();

        for (String symbol : symbols) {
            CachedQuote cached = cache.get(symbol);
            if (cached != null && cached.isFresh(now, ttl)) {
                hits.put(symbol, cached.quote());
            } else {
                misses.add(symbol);
            }
        }

        if (misses.isEmpty()) {
            log.debug("[{}] All {} quotes served from cache", name(), hits.size());
            return CompletableFuture.completedFuture(hits);
        }

        return delegate.getQuotes(misses).thenApply(fetched -> {
            Instant cachedAt = clock.instant();
            fetched.forEach((symbol, quote) -> cache.put(symbol, new CachedQuote(quote, cachedAt)));

            // Preserve requested symbol order
            Map<String, Quote> result = new LinkedHashMap<>();
            for (String symbol : symbols) {
                Quote q = hits.containsKey(symbol) ? hits.get(symbol) : fetched.get(symbol);
                if (q != null) {
                    result.put(symbol, q);
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<Optional<Quote>> getQuote(String symbol) {
        CachedQuote cached = cache.get(symbol);
        if (cached != null && cached.isFresh(clock.instant(), ttl)) {
            return CompletableFuture.completedFuture(Optional.of(cached.quote()));
        }
        return delegate.getQuote(symbol).thenApply(quote -> {
            quote.ifPresent(q -> cache.put(symbol, new CachedQuote(q, clock.instant())));
            return quote;
        });
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        log.info("[{}] Quote cache cleared", name());
    }

    @Override
    public void close() {
        cache.clear();
        delegate.close();
    }

    record CachedQuote(Quote quote, Instant cachedAt) {
        boolean isFresh(Instant now, Duration ttl) {
            return !ttl.isZero() && Duration.between(cachedAt, now).compareTo(ttl) < 0;
        }
    }
}
