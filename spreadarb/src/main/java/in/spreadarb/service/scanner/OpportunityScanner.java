package in.spreadarb.service.scanner;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.domain.market.Quote;
import in.spreadarb.domain.signal.Opportunity;
import in.spreadarb.domain.trade.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares reference and comparison quotes and reports symbols whose spread reaches the
 * configured minimum.
 *
 * The spread is always measured against the reference price:
 * {@code |ref − cmp| / ref × 100}. The scanner holds no state and knows nothing about positions.
 */
public final class OpportunityScanner {
    private static final Logger log = LoggerFactory.getLogger(OpportunityScanner.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final List<String> symbols;
    private final BigDecimal minSpreadPercent;
    private final Duration maxQuoteAge;
    private final Clock clock;

    public OpportunityScanner(ArbitrageConfig config, Clock clock) {
        this.symbols = config.symbols();
        this.minSpreadPercent = config.minSpreadPercent();
        this.maxQuoteAge = config.risk().maxQuoteAge();
        this.clock = clock;
    }

    /**
     * Scan one tick's quotes.
     *
     * @return opportunities in configured symbol order; symbols missing from either map, or quoted
     *         longer ago than the maximum quote age, are skipped
     */
    public List<Opportunity> scan(Map<String, Quote> referenceQuotes, Map<String, Quote> comparisonQuotes) {
        List<Opportunity> found = new ArrayList<>();
        Instant now = clock.instant();

        for (String symbol : symbols) {
            Quote ref = referenceQuotes.get(symbol);
            Quote cmp = comparisonQuotes.get(symbol);
            if (ref == null || cmp == null) {
                continue;
            }
            if (ref.isStale(now, maxQuoteAge) || cmp.isStale(now, maxQuoteAge)) {
                log.warn("⚠️ {} skipped for entry: stale quote (ref at {}, cmp at {})",
                    symbol, ref.timestamp(), cmp.timestamp());
                continue;
            }

            BigDecimal spread = spreadPercent(ref.price(), cmp.price());
            if (spread.compareTo(minSpreadPercent) < 0) {
                log.debug("{} spread {}% below {}%", symbol, spread.toPlainString(), minSpreadPercent);
                continue;
            }

            Side direction = direction(ref.price(), cmp.price());
            found.add(new Opportunity(symbol, ref.price(), cmp.price(), spread, direction, now));
        }

        return found;
    }

    /**
     * {@code |ref − cmp| / ref × 100}. Not symmetric in its arguments.
     */
    public static BigDecimal spreadPercent(BigDecimal referencePrice, BigDecimal comparisonPrice) {
        return referencePrice.subtract(comparisonPrice).abs()
            .divide(referencePrice, MathContext.DECIMAL64)
            .multiply(HUNDRED);
    }

    /**
     * LONG when the reference venue is the cheaper one, SHORT otherwise (including equal prices).
     */
    public static Side direction(BigDecimal referencePrice, BigDecimal comparisonPrice) {
        return referencePrice.compareTo(comparisonPrice) < 0 ? Side.LONG : Side.SHORT;
    }
}
