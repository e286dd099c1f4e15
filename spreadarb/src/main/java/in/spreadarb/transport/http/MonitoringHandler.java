package in.spreadarb.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.spreadarb.service.engine.ArbitrageScheduler;
import in.spreadarb.service.stats.StatisticsAggregator;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Read-only JSON endpoints over the running engine.
 *
 * - GET /status - running flag, mode, open positions, session statistics
 * - GET /status/history - archived daily performance, oldest first
 * - GET /health - liveness
 */
public final class MonitoringHandler {
    private static final Logger log = LoggerFactory.getLogger(MonitoringHandler.class);

    private final ArbitrageScheduler scheduler;
    private final StatisticsAggregator stats;
    private final ObjectMapper mapper;

    public MonitoringHandler(ArbitrageScheduler scheduler, StatisticsAggregator stats, ObjectMapper mapper) {
        this.scheduler = scheduler;
        this.stats = stats;
        this.mapper = mapper;
    }

    public void getStatus(HttpServerExchange exchange) {
        try {
            sendJson(exchange, scheduler.status());
        } catch (Exception e) {
            log.error("Failed to get status", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get status: " + e.getMessage());
        }
    }

    public void getHistory(HttpServerExchange exchange) {
        try {
            sendJson(exchange, Map.of("days", stats.history()));
        } catch (Exception e) {
            log.error("Failed to get history", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get history: " + e.getMessage());
        }
    }

    public void getHealth(HttpServerExchange exchange) {
        try {
            sendJson(exchange, Map.of("status", scheduler.isRunning() ? "UP" : "STOPPED"));
        } catch (Exception e) {
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, Object data) throws Exception {
        String json = mapper.writeValueAsString(data);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
