package in.spreadarb.service.event;

import in.spreadarb.domain.trade.TradeEvent;

/**
 * Destination for engine events (log file, journal, websocket...).
 */
@FunctionalInterface
public interface TradeEventSink {
    void accept(TradeEvent event);
}
