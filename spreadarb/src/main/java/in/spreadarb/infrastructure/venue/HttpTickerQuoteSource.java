package in.spreadarb.infrastructure.venue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.config.QuoteFeedConfig;
import in.spreadarb.domain.market.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Quote source backed by a public, unauthenticated JSON ticker endpoint.
 *
 * One GET per symbol, built from {@link QuoteFeedConfig#urlFor(String)}; the price is read from
 * the response with a JSON pointer (e.g. {@code /price} for a MEXC spot ticker,
 * {@code /pairs/0/priceUsd} for a DexScreener search). Symbols are requested in parallel and
 * any symbol that fails is simply left out of the result map.
 *
 * When a whole batch fails the feed backs off (see {@link FeedBackoffPolicy}) and returns empty
 * maps until the next attempt is allowed.
 */
public class HttpTickerQuoteSource implements QuoteSource {
    private static final Logger log = LoggerFactory.getLogger(HttpTickerQuoteSource.class);

    private final QuoteFeedConfig feed;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final FeedBackoffPolicy backoff;
    private final Duration requestTimeout;
    private final Clock clock;
    private final ExecutorService executor;

    public HttpTickerQuoteSource(QuoteFeedConfig feed, ObjectMapper mapper, Duration requestTimeout) {
        this(feed,
            HttpClient.newBuilder().connectTimeout(requestTimeout).build(),
            mapper,
            FeedBackoffPolicy.forTickerFeed(),
            requestTimeout,
            Clock.systemUTC());
    }

    public HttpTickerQuoteSource(QuoteFeedConfig feed, HttpClient httpClient, ObjectMapper mapper,
                                 FeedBackoffPolicy backoff, Duration requestTimeout, Clock clock) {
        this.feed = feed;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.backoff = backoff;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "quotes-" + feed.name().toLowerCase() + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return feed.name();
    }

    @Override
    public CompletableFuture<Map<String, Quote>> getQuotes(List<String> symbols) {
        Instant now = clock.instant();
        if (!backoff.allowsAttempt(now)) {
            log.debug("[{}] Backing off until {}, skipping fetch", feed.name(), backoff.getNextAttemptAt());
            return CompletableFuture.completedFuture(Map.of());
        }

        List<CompletableFuture<Optional<Quote>>> futures = symbols.stream()
            .map(this::fetch)
            .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                Map<String, Quote> quotes = new LinkedHashMap<>();
                for (CompletableFuture<Optional<Quote>> f : futures) {
                    f.join().ifPresent(q -> quotes.put(q.symbol(), q));
                }

                if (quotes.isEmpty() && !symbols.isEmpty()) {
                    backoff.recordFailure(clock.instant());
                    log.warn("[{}] No quotes for {} symbols (failure #{}, circuitOpen={})",
                        feed.name(), symbols.size(), backoff.getFailureCount(), backoff.isCircuitOpen());
                } else {
                    backoff.recordSuccess();
                }
                return quotes;
            });
    }

    @Override
    public CompletableFuture<Optional<Quote>> getQuote(String symbol) {
        return fetch(symbol);
    }

    /**
     * Never completes exceptionally; failures are logged and mapped to empty.
     */
    private CompletableFuture<Optional<Quote>> fetch(String symbol) {
        return CompletableFuture.supplyAsync(() -> {
            String url = feed.urlFor(symbol);
            try {
                HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();

                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() != 200) {
                    throw new QuoteUnavailableException(feed.name(), symbol, "HTTP " + response.statusCode());
                }
                return parseQuote(symbol, response.body(), clock.instant());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] Interrupted fetching {}", feed.name(), symbol);
                return Optional.<Quote>empty();
            } catch (Exception e) {
                log.warn("[{}] Quote fetch failed for {} ({}): {}", feed.name(), symbol, url, e.getMessage());
                return Optional.<Quote>empty();
            }
        }, executor);
    }

    /**
     * Extract the price at the configured JSON pointer. Prices may be JSON strings or numbers.
     */
    Optional<Quote> parseQuote(String symbol, String body, Instant fetchedAt) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode priceNode = root.at(feed.pricePointer());
        if (priceNode.isMissingNode() || priceNode.isNull()) {
            log.debug("[{}] No price at {} for {}", feed.name(), feed.pricePointer(), symbol);
            return Optional.empty();
        }

        BigDecimal price;
        try {
            price = priceNode.isNumber() ? priceNode.decimalValue() : new BigDecimal(priceNode.asText().trim());
        } catch (NumberFormatException e) {
            log.warn("[{}] Unparseable price '{}' for {}", feed.name(), priceNode.asText(), symbol);
            return Optional.empty();
        }

        if (price.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(Quote.of(symbol, price, fetchedAt));
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.info("[{}] Quote source closed", feed.name());
    }
}
