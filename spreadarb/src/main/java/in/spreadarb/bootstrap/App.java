package in.spreadarb.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.config.ArbitrageConfig;
import in.spreadarb.config.ConfigInvalidException;
import in.spreadarb.config.QuoteFeedConfig;
import in.spreadarb.config.RiskLimits;
import in.spreadarb.config.SizingPolicy;
import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.infrastructure.metrics.EngineMetrics;
import in.spreadarb.infrastructure.metrics.PrometheusEngineMetrics;
import in.spreadarb.infrastructure.venue.CachingQuoteSource;
import in.spreadarb.infrastructure.venue.HttpTickerQuoteSource;
import in.spreadarb.infrastructure.venue.OrderGateway;
import in.spreadarb.infrastructure.venue.OrderGatewayProvider;
import in.spreadarb.infrastructure.venue.QuoteSource;
import in.spreadarb.infrastructure.venue.SimulatedOrderGateway;
import in.spreadarb.service.engine.ArbitrageScheduler;
import in.spreadarb.service.engine.SleepingTickTimer;
import in.spreadarb.service.event.LoggingTradeEventSink;
import in.spreadarb.service.event.TradeEventPublisher;
import in.spreadarb.service.position.PositionManager;
import in.spreadarb.service.scanner.OpportunityScanner;
import in.spreadarb.service.sizing.PositionSizers;
import in.spreadarb.service.stats.StatisticsAggregator;
import in.spreadarb.transport.http.MonitoringHandler;
import in.spreadarb.transport.http.MonitoringServer;
import in.spreadarb.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Spread arbitrage engine entry point.
 *
 * Wiring:
 * - Config from environment, validated before anything starts
 * - Reference / comparison quote sources (public JSON tickers, optional TTL cache)
 * - Order gateway: simulated in TEST mode, ServiceLoader provider in LIVE mode
 * - Scanner, position manager, statistics, event publisher
 * - Optional Undertow monitoring endpoint (/metrics, /status)
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Spread Arbitrage Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration + validation gate
        // ═══════════════════════════════════════════════════════════════
        ArbitrageConfig config = ArbitrageConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (ConfigInvalidException e) {
            log.error("❌ STARTUP VALIDATION FAILED ({} violations)", e.getViolations().size(), e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }
        printSettings(config);

        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = Json.newMapper();

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics prometheus = null;
        EngineMetrics metrics = EngineMetrics.noop();
        if (config.metricsPort() > 0) {
            prometheus = new PrometheusEngineMetrics();
            metrics = prometheus;
            log.info("✓ Prometheus metrics initialized");
        }

        // ═══════════════════════════════════════════════════════════════
        // Venues
        // ═══════════════════════════════════════════════════════════════
        QuoteSource reference = quoteSource(config.referenceFeed(), config, mapper, clock);
        QuoteSource comparison = quoteSource(config.comparisonFeed(), config, mapper, clock);
        log.info("✓ Quote sources: reference={} comparison={}", reference.name(), comparison.name());

        OrderGateway gateway;
        try {
            gateway = createGateway(config, reference, clock);
        } catch (IllegalStateException e) {
            log.error("❌ {}", e.getMessage());
            reference.close();
            comparison.close();
            System.exit(1);
            return;
        }
        log.info("✓ Order gateway ready ({} mode)", gateway.mode());

        // ═══════════════════════════════════════════════════════════════
        // Engine
        // ═══════════════════════════════════════════════════════════════
        TradeEventPublisher events = new TradeEventPublisher(mapper, List.of(new LoggingTradeEventSink(mapper)), clock);
        StatisticsAggregator stats = new StatisticsAggregator(config, LocalDate.now(clock), events, metrics);
        PositionManager positionManager = new PositionManager(
            config, gateway, reference, PositionSizers.from(config.risk()), stats, events, metrics, clock);
        OpportunityScanner scanner = new OpportunityScanner(config, clock);

        ArbitrageScheduler scheduler = new ArbitrageScheduler(
            config, reference, comparison, gateway, scanner, positionManager,
            stats, events, metrics, clock, new SleepingTickTimer());

        try {
            scheduler.preflight();
        } catch (RuntimeException e) {
            log.error("❌ PREFLIGHT FAILED: {}", e.getMessage(), e);
            scheduler.shutdown();
            System.exit(1);
        }

        // ═══════════════════════════════════════════════════════════════
        // Monitoring endpoint
        // ═══════════════════════════════════════════════════════════════
        MonitoringServer monitoringServer = null;
        if (prometheus != null) {
            monitoringServer = new MonitoringServer(config.metricsPort(), "0.0.0.0", prometheus.getRegistry(),
                new MonitoringHandler(scheduler, stats, mapper));
            monitoringServer.start();
        }

        // Stop between ticks on SIGINT/SIGTERM and let the loop run its own shutdown
        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.requestStop();
            try {
                mainThread.join(config.gatewayTimeout().toMillis() * 2 + config.tickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook"));

        scheduler.run();

        if (monitoringServer != null) {
            monitoringServer.close();
        }
        log.info("=== Spread Arbitrage Engine Stopped ===");
    }

    private static QuoteSource quoteSource(QuoteFeedConfig feed, ArbitrageConfig config, ObjectMapper mapper, Clock clock) {
        QuoteSource source = new HttpTickerQuoteSource(feed, mapper, config.quoteFetchTimeout());
        if (!feed.cacheTtl().isZero()) {
            source = new CachingQuoteSource(source, feed.cacheTtl(), clock);
        }
        return source;
    }

    /**
     * TEST: simulated gateway. LIVE: first {@link OrderGatewayProvider} whose venue matches the
     * reference feed name.
     */
    static OrderGateway createGateway(ArbitrageConfig config, QuoteSource reference, Clock clock) {
        if (config.gatewayMode() == GatewayMode.TEST) {
            return new SimulatedOrderGateway(reference, config.paperBalance(), clock);
        }

        String venue = config.referenceFeed().name();
        for (OrderGatewayProvider provider : ServiceLoader.load(OrderGatewayProvider.class)) {
            if (provider.venue().equalsIgnoreCase(venue)) {
                log.info("✓ LIVE gateway provider found: {}", provider.getClass().getName());
                return provider.create(config);
            }
        }
        throw new IllegalStateException("LIVE mode requested but no OrderGatewayProvider is registered for venue "
            + venue + " (set TEST_MODE=true for simulated trading)");
    }

    private static void printSettings(ArbitrageConfig config) {
        RiskLimits risk = config.risk();
        SizingPolicy sizing = risk.sizing();

        log.info("Settings:");
        log.info("  Symbols:          {}", config.symbols());
        log.info("  Min spread:       {}%", config.minSpreadPercent().toPlainString());
        log.info("  Target spread:    {}%", config.targetSpreadPercent().toPlainString());
        if (sizing.isFixedNotional()) {
            log.info("  Sizing:           fixed ${} notional", sizing.notionalUsd().toPlainString());
        } else {
            log.info("  Sizing:           {} of free balance, max ${}",
                sizing.riskFraction().toPlainString(), sizing.maxNotionalUsd().toPlainString());
        }
        log.info("  Leverage:         {}x", risk.leverage());
        log.info("  Stop / take:      {}% / {}%",
            risk.stopLossPercent().toPlainString(), risk.takeProfitPercent().toPlainString());
        log.info("  Max positions:    {}", risk.maxPositions());
        log.info("  Max hold:         {}s", risk.maxHoldDuration().toSeconds());
        log.info("  Fee rate:         {}", risk.feeRate().toPlainString());
        log.info("  Max daily loss:   ${}", risk.maxDailyLoss().toPlainString());
        log.info("  Tick interval:    {}ms", config.tickInterval().toMillis());
        log.info("  Mode:             {}", config.gatewayMode());
    }

    private App() {}
}
