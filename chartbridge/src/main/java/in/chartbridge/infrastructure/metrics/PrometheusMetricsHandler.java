package in.chartbridge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics in Prometheus text format.
 *
 * {@code ?name[]=tv_pool_connections&name[]=tv_pool_leases_total} limits the scrape to the
 * named samples, as the Prometheus Java exporters do.
 *
 * Example output:
 * <pre>
 * # HELP tv_pool_leases_total Total number of pool lease attempts by outcome
 * # TYPE tv_pool_leases_total counter
 * tv_pool_leases_total{outcome="reused",} 412.0
 * tv_pool_leases_total{outcome="created",} 23.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        StringWriter body = new StringWriter();
        try {
            Set<String> names = requestedNames(exchange);
            // the filtered form skips labelled families without children, so a cold scrape goes unfiltered
            TextFormat.write004(body, names.isEmpty()
                    ? registry.metricFamilySamples()
                    : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage(), StandardCharsets.UTF_8);
            return;
        }

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
        log.trace("[METRICS] Scrape served, {} chars", body.getBuffer().length());
    }

    /**
     * @return the requested sample names, empty for everything
     */
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        return names == null ? Set.of() : new HashSet<>(names);
    }
}
