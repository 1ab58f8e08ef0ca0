package in.chartbridge.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.chartbridge.application.service.ChartDataService;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.infrastructure.tradingview.pool.PersistentConnectionManager;
import in.chartbridge.infrastructure.tradingview.pool.PoolStats;
import in.chartbridge.service.validation.ChartRequestValidator;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;

import static in.chartbridge.transport.http.ChartJson.JSON_DATA;
import static in.chartbridge.transport.http.ChartJson.JSON_SUCCESS;
import static in.chartbridge.transport.http.ChartJson.MAPPER;

/**
 * Health and single chart endpoints.
 */
public final class ChartApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ChartApiHandlers.class);

    private final ChartDataService chartDataService;
    private final PersistentConnectionManager connectionManager;

    public ChartApiHandlers(ChartDataService chartDataService, PersistentConnectionManager connectionManager) {
        this.chartDataService = chartDataService;
        this.connectionManager = connectionManager;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());

        ObjectNode manager = health.putObject("connectionManager");
        manager.put("refCount", connectionManager.getRefCount());
        manager.put("poolsCreated", connectionManager.getPoolsCreated());
        PoolStats stats = connectionManager.poolStats();
        if (stats != null) {
            manager.set("pool", MAPPER.valueToTree(stats));
        } else {
            manager.putNull("pool");
        }
        ChartJson.send(exchange, 200, health);
    }

    /**
     * GET /api/chart-data?symbol=&amp;resolution=&amp;barsCount=&amp;cvdEnabled=&amp;cvdAnchorPeriod=&amp;cvdTimeframe=
     *
     * Blocks on the upstream fetch, so it runs on a worker thread.
     */
    public void chartData(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::chartData);
            return;
        }

        String jwt = ChartJson.bearerToken(exchange);
        if (jwt == null) {
            ChartJson.error(exchange, 401, "Missing bearer token");
            return;
        }

        ChartRequest request;
        try {
            request = ChartRequestValidator.fromParams(
                param(exchange, "symbol"),
                param(exchange, "resolution"),
                param(exchange, "barsCount"),
                Boolean.parseBoolean(param(exchange, "cvdEnabled")),
                param(exchange, "cvdAnchorPeriod"),
                param(exchange, "cvdTimeframe"));
        } catch (RuntimeException e) {
            ChartJson.error(exchange, 400, e.getMessage());
            return;
        }

        try {
            ChartData data = chartDataService.fetch(jwt, request);
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.set(JSON_DATA, ChartJson.chart(data));
            ChartJson.send(exchange, 200, response);
        } catch (RuntimeException e) {
            int status = ChartJson.statusFor(e);
            if (status >= 500) {
                log.error("[CHART API] {} {} failed: {}", request.symbol(), request.resolution(), e.getMessage(), e);
            } else {
                log.warn("[CHART API] {} {} failed ({}): {}", request.symbol(), request.resolution(), status, e.getMessage());
            }
            ChartJson.error(exchange, status, ChartJson.messageFor(e));
        }
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }
}
