package in.spreadarb.service.engine;

import in.spreadarb.domain.monitoring.SessionStats;
import in.spreadarb.domain.order.GatewayMode;
import in.spreadarb.domain.trade.Position;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the engine for the status endpoint and logs.
 */
public record EngineStatus(
    boolean running,
    GatewayMode mode,
    String referenceVenue,
    String comparisonVenue,
    List<String> symbols,
    Instant startedAt,
    long ticks,
    List<Position> openPositions,
    SessionStats stats,
    double winRate
) {}
