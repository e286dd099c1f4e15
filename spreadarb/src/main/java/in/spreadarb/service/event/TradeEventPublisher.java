package in.spreadarb.service.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.trade.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds typed events and hands them to every registered sink.
 * A failing sink is logged and skipped; it never fails the caller.
 */
public final class TradeEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(TradeEventPublisher.class);

    private final ObjectMapper mapper;
    private final List<TradeEventSink> sinks;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong(0);

    public TradeEventPublisher(ObjectMapper mapper, List<TradeEventSink> sinks, Clock clock) {
        this.mapper = mapper;
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // SYMBOL EVENTS
    // ═══════════════════════════════════════════════════════════════

    public TradeEvent emit(EventType type, String symbol, Object payloadPojo) {
        JsonNode payload = mapper.valueToTree(payloadPojo);
        TradeEvent e = new TradeEvent(seq.incrementAndGet(), type, symbol, payload, clock.instant());
        return dispatch(e);
    }

    // ═══════════════════════════════════════════════════════════════
    // SESSION EVENTS
    // ═══════════════════════════════════════════════════════════════

    public TradeEvent emitSession(EventType type, Object payloadPojo) {
        return emit(type, null, payloadPojo);
    }

    /**
     * Number of events emitted so far.
     */
    public long lastSeq() {
        return seq.get();
    }

    private TradeEvent dispatch(TradeEvent e) {
        for (TradeEventSink sink : sinks) {
            try {
                sink.accept(e);
            } catch (RuntimeException ex) {
                log.warn("Event sink {} failed for seq={} type={}: {}",
                    sink.getClass().getSimpleName(), e.seq(), e.type(), ex.getMessage());
            }
        }
        log.debug("Event emitted: seq={}, type={}, symbol={}", e.seq(), e.type(), e.symbol());
        return e;
    }
}
