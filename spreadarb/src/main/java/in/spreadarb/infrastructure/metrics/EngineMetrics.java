package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.trade.ExitReason;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Engine metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Quote fetch coverage and latency per venue
 * - Opportunities detected
 * - Entry decisions by outcome
 * - Exits by reason and realized PnL
 * - Gateway call latency and failures
 * - Open positions, session PnL, tick duration
 */
public interface EngineMetrics {

    /**
     * Record one batch quote fetch.
     *
     * @param venue Quote source name
     * @param requested Number of symbols requested
     * @param received Number of quotes returned
     * @param latency Time until the batch completed (or timed out)
     */
    void recordQuoteFetch(String venue, int requested, int received, Duration latency);

    void recordOpportunity(String symbol);

    /**
     * Record the outcome of an entry attempt.
     *
     * @param outcome EntryDecision outcome name (OPENED, MAX_POSITIONS, ...)
     */
    void recordEntryDecision(String symbol, String outcome);

    void recordExit(String symbol, ExitReason reason, BigDecimal pnl);

    void recordCloseFailure(String symbol);

    /**
     * Record an order gateway call.
     *
     * @param operation open, close or balance
     */
    void recordGatewayCall(String operation, boolean success, Duration latency);

    void updateOpenPositions(int count);

    void updateSessionPnl(BigDecimal totalPnl, BigDecimal dailyPnl);

    void recordTick(Duration duration);

    /**
     * Metrics sink that drops everything. Used when no registry is configured.
     */
    static EngineMetrics noop() {
        return NoopEngineMetrics.INSTANCE;
    }
}
