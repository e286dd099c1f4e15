package in.spreadarb.service.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.domain.trade.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON line to the {@code TRADES} logger (routed to logs/trades.log).
 */
public final class LoggingTradeEventSink implements TradeEventSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingTradeEventSink.class);
    private static final Logger TRADES = LoggerFactory.getLogger("TRADES");

    private final ObjectMapper mapper;

    public LoggingTradeEventSink(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void accept(TradeEvent event) {
        try {
            TRADES.info(mapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event seq={} type={}: {}", event.seq(), event.type(), e.getMessage());
        }
    }
}
