package in.spreadarb.config;

import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Complete configuration of one run.
 *
 * Built once at startup (see {@link #fromEnv()}), validated by
 * {@code StartupConfigValidator} and then passed explicitly to every component.
 * There is no global configuration instance.
 */
public record ArbitrageConfig(
    // Scanner
    BigDecimal minSpreadPercent,      // entry threshold, 7.5 = 7.5%
    BigDecimal targetSpreadPercent,   // convergence exit threshold

    // Risk
    RiskLimits risk,

    // Scheduler
    List<String> symbols,             // ordered; entry order follows this list
    Duration tickInterval,
    Duration quoteFetchTimeout,
    Duration gatewayTimeout,
    Duration statsLogInterval,

    // Collaborators
    GatewayMode gatewayMode,
    BigDecimal paperBalance,
    QuoteFeedConfig referenceFeed,
    QuoteFeedConfig comparisonFeed,
    int metricsPort                   // 0 disables the monitoring endpoint
) {
    public static final List<String> DEFAULT_SYMBOLS = List.of("BTC/USDT", "ETH/USDT", "BNB/USDT");

    public ArbitrageConfig {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    /**
     * Defaults matching the bot's shipped settings.
     */
    public static ArbitrageConfig defaults() {
        return new ArbitrageConfig(
            new BigDecimal("7.5"),
            new BigDecimal("1.5"),
            RiskLimits.defaults(),
            DEFAULT_SYMBOLS,
            Duration.ofSeconds(5),
            Duration.ofSeconds(3),
            Duration.ofSeconds(10),
            Duration.ofMinutes(10),
            GatewayMode.TEST,
            new BigDecimal("1000"),
            defaultReferenceFeed(),
            defaultComparisonFeed(),
            0
        );
    }

    /**
     * Build configuration from environment variables / system properties over {@link #defaults()}.
     */
    public static ArbitrageConfig fromEnv() {
        ArbitrageConfig d = defaults();
        RiskLimits r = d.risk();

        SizingPolicy sizing;
        String policy = Env.get("SIZING_POLICY", r.sizing().type().name());
        if (SizingPolicyType.FIXED_NOTIONAL.name().equalsIgnoreCase(policy)) {
            sizing = SizingPolicy.fixedNotional(decimal("NOTIONAL_USD", new BigDecimal("5.10")));
        } else {
            sizing = SizingPolicy.riskFraction(
                decimal("RISK_FRACTION", r.sizing().riskFraction()),
                decimal("MAX_POSITION_SIZE", r.sizing().maxNotionalUsd()));
        }

        RiskLimits risk = new RiskLimits(
            Env.getInt("MAX_POSITIONS", r.maxPositions()),
            sizing,
            Env.getInt("LEVERAGE", r.leverage()),
            decimal("STOP_LOSS_PERCENT", r.stopLossPercent()),
            decimal("TAKE_PROFIT_PERCENT", r.takeProfitPercent()),
            Env.getSeconds("MAX_HOLD_SECONDS", r.maxHoldDuration()),
            decimal("FEE_RATE", r.feeRate()),
            decimal("MIN_FREE_BALANCE", r.minFreeBalance()),
            decimal("MAX_DAILY_LOSS", r.maxDailyLoss()),
            Env.getSeconds("MAX_PRICE_AGE_SECONDS", r.maxQuoteAge())
        );

        return new ArbitrageConfig(
            decimal("MIN_SPREAD_PERCENT", d.minSpreadPercent()),
            decimal("TARGET_SPREAD_PERCENT", d.targetSpreadPercent()),
            risk,
            Env.getList("SYMBOLS", d.symbols()),
            Env.getSeconds("PRICE_UPDATE_INTERVAL_SECONDS", d.tickInterval()),
            Env.getSeconds("QUOTE_FETCH_TIMEOUT_SECONDS", d.quoteFetchTimeout()),
            Env.getSeconds("GATEWAY_TIMEOUT_SECONDS", d.gatewayTimeout()),
            Env.getSeconds("STATS_LOG_INTERVAL_SECONDS", d.statsLogInterval()),
            GatewayMode.fromTestFlag(Env.getBool("TEST_MODE", true)),
            decimal("PAPER_BALANCE", d.paperBalance()),
            feedFromEnv("REFERENCE", d.referenceFeed()),
            feedFromEnv("COMPARISON", d.comparisonFeed()),
            Env.getInt("METRICS_PORT", d.metricsPort())
        );
    }

    /**
     * Copy with a different symbol list.
     */
    public ArbitrageConfig withSymbols(List<String> newSymbols) {
        return new ArbitrageConfig(minSpreadPercent, targetSpreadPercent, risk, newSymbols,
            tickInterval, quoteFetchTimeout, gatewayTimeout, statsLogInterval,
            gatewayMode, paperBalance, referenceFeed, comparisonFeed, metricsPort);
    }

    /**
     * Copy with different risk limits.
     */
    public ArbitrageConfig withRisk(RiskLimits newRisk) {
        return new ArbitrageConfig(minSpreadPercent, targetSpreadPercent, newRisk, symbols,
            tickInterval, quoteFetchTimeout, gatewayTimeout, statsLogInterval,
            gatewayMode, paperBalance, referenceFeed, comparisonFeed, metricsPort);
    }

    /**
     * Copy with different spread thresholds.
     */
    public ArbitrageConfig withSpreads(BigDecimal newMinSpreadPercent, BigDecimal newTargetSpreadPercent) {
        return new ArbitrageConfig(newMinSpreadPercent, newTargetSpreadPercent, risk, symbols,
            tickInterval, quoteFetchTimeout, gatewayTimeout, statsLogInterval,
            gatewayMode, paperBalance, referenceFeed, comparisonFeed, metricsPort);
    }

    private static QuoteFeedConfig defaultReferenceFeed() {
        return new QuoteFeedConfig(
            "MEXC",
            "https://api.mexc.com/api/v3/ticker/price?symbol={symbol}",
            "/price",
            "",
            Duration.ZERO
        );
    }

    private static QuoteFeedConfig defaultComparisonFeed() {
        return new QuoteFeedConfig(
            "DEXSCREENER",
            "https://api.dexscreener.com/latest/dex/search?q={base}%20{quote}",
            "/pairs/0/priceUsd",
            "",
            Duration.ofSeconds(1)
        );
    }

    private static QuoteFeedConfig feedFromEnv(String prefix, QuoteFeedConfig fallback) {
        return new QuoteFeedConfig(
            Env.get(prefix + "_VENUE_NAME", fallback.name()),
            Env.get(prefix + "_TICKER_URL", fallback.urlTemplate()),
            Env.get(prefix + "_PRICE_POINTER", fallback.pricePointer()),
            Env.get(prefix + "_SYMBOL_SEPARATOR", fallback.symbolSeparator()),
            Env.getSeconds(prefix + "_CACHE_TTL_SECONDS", fallback.cacheTtl())
        );
    }

    private static BigDecimal decimal(String key, BigDecimal defaultValue) {
        String value = Env.get(key, null);
        if (value == null) return defaultValue;
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
