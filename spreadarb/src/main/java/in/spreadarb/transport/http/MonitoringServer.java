package in.spreadarb.transport.http;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Undertow server for /metrics, /status, /status/history and /health.
 */
public final class MonitoringServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MonitoringServer.class);

    private final Undertow server;
    private final int port;

    public MonitoringServer(int port, String host, CollectorRegistry registry, MonitoringHandler monitoring) {
        this.port = port;

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(registry))
            .get("/status", monitoring::getStatus)
            .get("/status/history", monitoring::getHistory)
            .get("/health", monitoring::getHealth)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Spread arbitrage engine\n\n" +
                    "GET /metrics, /status, /status/history, /health\n"
                );
            });

        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("✓ Monitoring endpoint started on http://localhost:{}/ (metrics, status)", port);
    }

    @Override
    public void close() {
        server.stop();
        log.info("Monitoring endpoint stopped");
    }
}
