package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.trade.ExitReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - arb_quote_fetch_total{venue, coverage} - Batch fetches (full / partial / empty)
 * - arb_quote_fetch_latency_seconds{venue} - Batch fetch latency
 * - arb_opportunities_total{symbol} - Opportunities at or above the minimum spread
 * - arb_entry_decisions_total{symbol, outcome} - Entry attempts by outcome
 * - arb_exits_total{symbol, reason} - Closed positions by exit reason
 * - arb_realized_pnl_usd_total{symbol, result} - Realized PnL magnitude, split into profit / loss
 * - arb_close_failures_total{symbol} - Gateway close failures (position retained)
 * - arb_gateway_calls_total{operation, status} / arb_gateway_latency_seconds{operation}
 * - arb_open_positions, arb_session_pnl_usd, arb_daily_pnl_usd
 * - arb_tick_duration_seconds
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    // Quote metrics
    private final Counter quoteFetchCounter;
    private final Histogram quoteFetchLatency;

    // Trading metrics
    private final Counter opportunityCounter;
    private final Counter entryDecisionCounter;
    private final Counter exitCounter;
    private final Counter realizedPnl;
    private final Counter closeFailureCounter;

    // Gateway metrics
    private final Counter gatewayCallCounter;
    private final Histogram gatewayLatency;

    // State gauges
    private final Gauge openPositions;
    private final Gauge sessionPnl;
    private final Gauge dailyPnl;

    private final Histogram tickDuration;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.quoteFetchCounter = Counter.build()
            .name("arb_quote_fetch_total")
            .help("Total number of batch quote fetches")
            .labelNames("venue", "coverage")
            .register(registry);

        this.quoteFetchLatency = Histogram.build()
            .name("arb_quote_fetch_latency_seconds")
            .help("Batch quote fetch latency in seconds")
            .labelNames("venue")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.opportunityCounter = Counter.build()
            .name("arb_opportunities_total")
            .help("Total number of detected opportunities")
            .labelNames("symbol")
            .register(registry);

        this.entryDecisionCounter = Counter.build()
            .name("arb_entry_decisions_total")
            .help("Total number of entry decisions by outcome")
            .labelNames("symbol", "outcome")
            .register(registry);

        this.exitCounter = Counter.build()
            .name("arb_exits_total")
            .help("Total number of closed positions")
            .labelNames("symbol", "reason")
            .register(registry);

        this.realizedPnl = Counter.build()
            .name("arb_realized_pnl_usd_total")
            .help("Absolute realized PnL in USD, split by profit and loss")
            .labelNames("symbol", "result")
            .register(registry);

        this.closeFailureCounter = Counter.build()
            .name("arb_close_failures_total")
            .help("Total number of failed close attempts")
            .labelNames("symbol")
            .register(registry);

        this.gatewayCallCounter = Counter.build()
            .name("arb_gateway_calls_total")
            .help("Total number of order gateway calls")
            .labelNames("operation", "status")
            .register(registry);

        this.gatewayLatency = Histogram.build()
            .name("arb_gateway_latency_seconds")
            .help("Order gateway call latency in seconds")
            .labelNames("operation")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.openPositions = Gauge.build()
            .name("arb_open_positions")
            .help("Current number of open positions")
            .register(registry);

        this.sessionPnl = Gauge.build()
            .name("arb_session_pnl_usd")
            .help("Cumulative realized PnL in USD")
            .register(registry);

        this.dailyPnl = Gauge.build()
            .name("arb_daily_pnl_usd")
            .help("Realized PnL of the current day in USD")
            .register(registry);

        this.tickDuration = Histogram.build()
            .name("arb_tick_duration_seconds")
            .help("Scheduler tick duration in seconds")
            .buckets(0.1, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordQuoteFetch(String venue, int requested, int received, Duration latency) {
        String coverage = received == 0 ? "empty" : received < requested ? "partial" : "full";
        quoteFetchCounter.labels(venue, coverage).inc();
        quoteFetchLatency.labels(venue).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOpportunity(String symbol) {
        opportunityCounter.labels(symbol).inc();
    }

    @Override
    public void recordEntryDecision(String symbol, String outcome) {
        entryDecisionCounter.labels(symbol, outcome).inc();
    }

    @Override
    public void recordExit(String symbol, ExitReason reason, BigDecimal pnl) {
        exitCounter.labels(symbol, reason.name()).inc();
        // Counters only go up, so losses are tracked as a separate series
        realizedPnl.labels(symbol, pnl.signum() >= 0 ? "profit" : "loss").inc(pnl.abs().doubleValue());
    }

    @Override
    public void recordCloseFailure(String symbol) {
        closeFailureCounter.labels(symbol).inc();
    }

    @Override
    public void recordGatewayCall(String operation, boolean success, Duration latency) {
        gatewayCallCounter.labels(operation, success ? "success" : "failure").inc();
        gatewayLatency.labels(operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void updateOpenPositions(int count) {
        openPositions.set(count);
    }

    @Override
    public void updateSessionPnl(BigDecimal total, BigDecimal daily) {
        sessionPnl.set(total.doubleValue());
        dailyPnl.set(daily.doubleValue());
    }

    @Override
    public void recordTick(Duration duration) {
        tickDuration.observe(duration.toMillis() / 1000.0);
    }

    /**
     * Get Prometheus CollectorRegistry for /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
