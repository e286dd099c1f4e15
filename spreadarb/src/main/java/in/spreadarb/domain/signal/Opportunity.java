package in.spreadarb.domain.signal;

import in.spreadarb.domain.trade.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A tradable spread detected in one tick. Never kept past the tick that produced it.
 */
public record Opportunity(
    String symbol,
    BigDecimal referencePrice,
    BigDecimal comparisonPrice,
    BigDecimal spreadPercent,
    Side direction,
    Instant detectedAt
) {}
