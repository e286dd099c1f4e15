package in.spreadarb.domain.trade;

import com.fasterxml.jackson.databind.JsonNode;
import in.spreadarb.domain.common.EventType;

import java.time.Instant;

/**
 * Typed engine event with a JSON payload.
 *
 * {@code symbol} is null for session-level events (rollover, summary).
 */
public record TradeEvent(
    long seq,
    EventType type,
    String symbol,
    JsonNode payload,
    Instant ts
) {
    public boolean isSessionLevel() {
        return symbol == null;
    }
}
