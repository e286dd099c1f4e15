package in.spreadarb.bootstrap;

import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.config.ConfigInvalidException;
import in.spreadarb.config.QuoteFeedConfig;
import in.spreadarb.config.RiskLimits;
import in.spreadarb.config.SizingPolicy;
import in.spreadarb.domain.order.GatewayMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Collects every violation and throws a single
 * {@link ConfigInvalidException}; the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private StartupConfigValidator() {}

    /**
     * @throws ConfigInvalidException listing all violations
     */
    public static void validate(ArbitrageConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> violations = new ArrayList<>();

        // Spread thresholds
        if (!isPositive(config.minSpreadPercent())) {
            violations.add("MIN_SPREAD_PERCENT must be > 0 (got " + config.minSpreadPercent() + ")");
        }
        if (!isPositive(config.targetSpreadPercent())) {
            violations.add("TARGET_SPREAD_PERCENT must be > 0 (got " + config.targetSpreadPercent() + ")");
        }
        if (isPositive(config.minSpreadPercent()) && isPositive(config.targetSpreadPercent())
                && config.targetSpreadPercent().compareTo(config.minSpreadPercent()) >= 0) {
            violations.add("TARGET_SPREAD_PERCENT (" + config.targetSpreadPercent()
                + ") must be below MIN_SPREAD_PERCENT (" + config.minSpreadPercent() + ")");
        }

        validateSymbols(config.symbols(), violations);
        validateRisk(config.risk(), violations);

        // Scheduler
        requirePositive("PRICE_UPDATE_INTERVAL_SECONDS", config.tickInterval(), violations);
        requirePositive("QUOTE_FETCH_TIMEOUT_SECONDS", config.quoteFetchTimeout(), violations);
        requirePositive("GATEWAY_TIMEOUT_SECONDS", config.gatewayTimeout(), violations);
        requirePositive("STATS_LOG_INTERVAL_SECONDS", config.statsLogInterval(), violations);

        // Collaborators
        if (config.gatewayMode() == GatewayMode.TEST && !isPositive(config.paperBalance())) {
            violations.add("PAPER_BALANCE must be > 0 in TEST mode");
        }
        validateFeed("REFERENCE", config.referenceFeed(), config.risk().maxQuoteAge(), violations);
        validateFeed("COMPARISON", config.comparisonFeed(), config.risk().maxQuoteAge(), violations);
        if (config.metricsPort() < 0 || config.metricsPort() > 65535) {
            violations.add("METRICS_PORT must be between 0 and 65535 (got " + config.metricsPort() + ")");
        }

        if (!violations.isEmpty()) {
            throw new ConfigInvalidException(violations);
        }

        if (config.gatewayMode() == GatewayMode.LIVE) {
            log.warn("⚠️  LIVE MODE - real orders will be placed on {}", config.referenceFeed().name());
        } else {
            log.info("✓ TEST mode - simulated fills, paper balance ${}", config.paperBalance().toPlainString());
        }
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateSymbols(List<String> symbols, List<String> violations) {
        if (symbols.isEmpty()) {
            violations.add("SYMBOLS must list at least one symbol");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (String symbol : symbols) {
            if (!symbol.contains("/")) {
                violations.add("Symbol '" + symbol + "' must be BASE/QUOTE (e.g. BTC/USDT)");
            }
            if (!seen.add(symbol)) {
                violations.add("Symbol '" + symbol + "' listed more than once");
            }
        }
    }

    private static void validateRisk(RiskLimits risk, List<String> violations) {
        if (risk.maxPositions() < 1) {
            violations.add("MAX_POSITIONS must be >= 1 (got " + risk.maxPositions() + ")");
        }
        if (risk.leverage() < 1) {
            violations.add("LEVERAGE must be >= 1 (got " + risk.leverage() + ")");
        }

        SizingPolicy sizing = risk.sizing();
        if (sizing.isFixedNotional()) {
            if (!isPositive(sizing.notionalUsd())) {
                violations.add("NOTIONAL_USD must be > 0 for FIXED_NOTIONAL sizing");
            }
        } else {
            if (!isPositive(sizing.riskFraction()) || sizing.riskFraction().compareTo(BigDecimal.ONE) > 0) {
                violations.add("RISK_FRACTION must be in (0, 1] (got " + sizing.riskFraction() + ")");
            }
            if (!isPositive(sizing.maxNotionalUsd())) {
                violations.add("MAX_POSITION_SIZE must be > 0 for RISK_FRACTION sizing");
            }
        }

        if (!isPositive(risk.stopLossPercent()) || risk.stopLossPercent().compareTo(HUNDRED) >= 0) {
            violations.add("STOP_LOSS_PERCENT must be in (0, 100) (got " + risk.stopLossPercent() + ")");
        }
        if (!isPositive(risk.takeProfitPercent()) || risk.takeProfitPercent().compareTo(HUNDRED) >= 0) {
            violations.add("TAKE_PROFIT_PERCENT must be in (0, 100) (got " + risk.takeProfitPercent() + ")");
        }
        if (risk.feeRate() == null || risk.feeRate().signum() < 0) {
            violations.add("FEE_RATE must be >= 0");
        }
        if (risk.minFreeBalance() == null || risk.minFreeBalance().signum() < 0) {
            violations.add("MIN_FREE_BALANCE must be >= 0");
        }
        if (risk.maxDailyLoss() == null || risk.maxDailyLoss().signum() < 0) {
            violations.add("MAX_DAILY_LOSS must be >= 0 (0 disables the limit)");
        }
        requirePositive("MAX_HOLD_SECONDS", risk.maxHoldDuration(), violations);
        requirePositive("MAX_PRICE_AGE_SECONDS", risk.maxQuoteAge(), violations);
    }

    private static void validateFeed(String prefix, QuoteFeedConfig feed, Duration maxQuoteAge,
                                     List<String> violations) {
        if (feed.name() == null || feed.name().isBlank()) {
            violations.add(prefix + "_VENUE_NAME must not be blank");
        }
        if (feed.urlTemplate() == null || !feed.urlTemplate().startsWith("http")) {
            violations.add(prefix + "_TICKER_URL must be an http(s) URL template");
        }
        if (feed.pricePointer() == null || !feed.pricePointer().startsWith("/")) {
            violations.add(prefix + "_PRICE_POINTER must be a JSON pointer starting with '/'");
        }
        if (feed.cacheTtl() == null || feed.cacheTtl().isNegative()) {
            violations.add(prefix + "_CACHE_TTL_SECONDS must be >= 0");
        } else if (maxQuoteAge != null && maxQuoteAge.compareTo(Duration.ZERO) > 0
                && feed.cacheTtl().compareTo(maxQuoteAge) >= 0) {
            // cached quotes would already count as stale; an invalid age is reported on its own
            violations.add(prefix + "_CACHE_TTL_SECONDS must be < MAX_PRICE_AGE_SECONDS (got "
                + feed.cacheTtl().toSeconds() + "s >= " + maxQuoteAge.toSeconds() + "s)");
        }
    }

    private static void requirePositive(String key, Duration value, List<String> violations) {
        if (value == null || value.isZero() || value.isNegative()) {
            violations.add(key + " must be > 0");
        }
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
