package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.trade.ExitReason;

import java.math.BigDecimal;
import java.time.Duration;

final class NoopEngineMetrics implements EngineMetrics {
    static final NoopEngineMetrics INSTANCE = new NoopEngineMetrics();

    private NoopEngineMetrics() {}

    @Override public void recordQuoteFetch(String venue, int requested, int received, Duration latency) {}
    @Override public void recordOpportunity(String symbol) {}
    @Override public void recordEntryDecision(String symbol, String outcome) {}
    @Override public void recordExit(String symbol, ExitReason reason, BigDecimal pnl) {}
    @Override public void recordCloseFailure(String symbol) {}
    @Override public void recordGatewayCall(String operation, boolean success, Duration latency) {}
    @Override public void updateOpenPositions(int count) {}
    @Override public void updateSessionPnl(BigDecimal totalPnl, BigDecimal dailyPnl) {}
    @Override public void recordTick(Duration duration) {}
}
