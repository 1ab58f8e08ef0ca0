package in.chartbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.chartbridge.application.service.BatchChartFetcher;
import in.chartbridge.application.service.BatchJobFailedException;
import in.chartbridge.config.TradingViewConfig;
import in.chartbridge.domain.batch.BatchJob;
import in.chartbridge.domain.batch.BatchSummary;
import in.chartbridge.domain.model.IndicatorSettings;
import in.chartbridge.infrastructure.tradingview.pool.PersistentConnectionManager;
import in.chartbridge.infrastructure.tradingview.pool.PoolHandle;
import in.chartbridge.service.validation.ChartRequestValidator;
import in.chartbridge.service.validation.ConstraintViolationException;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static in.chartbridge.transport.http.ChartJson.MAPPER;

/**
 * POST /api/chart-data/batch - streams batch progress as Server-Sent Events.
 *
 * Request body:
 * <pre>
 * {"symbols":["NSE:TCS","NSE:INFY"], "resolutions":["1D","60"], "barsCount":300,
 *  "cvdEnabled":true, "cvdAnchorPeriod":"3M", "cvdTimeframe":"15S",
 *  "batchSize":18, "parallelConnections":5}
 * </pre>
 *
 * Events, each {@code data: {"type":..., "data":...}}:
 * - {@code chart-batch}: one per completed group
 * - {@code complete}: totals once every group is done
 * - {@code error}: the job failed as a whole
 *
 * The shared pool is acquired before the first fetch and released when the stream ends.
 */
public class BatchStreamHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(BatchStreamHandler.class);

    private final BatchChartFetcher fetcher;
    private final PersistentConnectionManager connectionManager;
    private final TradingViewConfig config;

    public BatchStreamHandler(BatchChartFetcher fetcher,
                              PersistentConnectionManager connectionManager,
                              TradingViewConfig config) {
        this.fetcher = fetcher;
        this.connectionManager = connectionManager;
        this.config = config;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }
        exchange.startBlocking();

        String jwt = ChartJson.bearerToken(exchange);
        if (jwt == null) {
            ChartJson.error(exchange, 401, "Missing bearer token");
            return;
        }

        BatchJob job;
        try {
            job = parseJob(MAPPER.readTree(exchange.getInputStream()));
        } catch (IOException e) {
            ChartJson.error(exchange, 400, "Invalid JSON body");
            return;
        } catch (ConstraintViolationException | IllegalArgumentException e) {
            ChartJson.error(exchange, 400, e.getMessage());
            return;
        }

        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        exchange.getResponseHeaders().put(Headers.CONNECTION, "keep-alive");

        EventStream stream = new EventStream(exchange.getOutputStream());
        try (PoolHandle handle = connectionManager.acquire(jwt)) {
            BatchSummary summary = fetcher.fetch(job, handle,
                event -> stream.send("chart-batch", ChartJson.batch(event)));

            ObjectNode complete = MAPPER.createObjectNode();
            complete.put("totalCharts", summary.totalCharts());
            complete.put("totalTime", summary.totalDurationMs());
            complete.put("avgTimePerChart", summary.avgChartDurationMs());
            complete.put("successfulCharts", summary.successfulCharts());
            complete.put("failedCharts", summary.failedCharts());
            stream.send("complete", complete);
        } catch (BatchJobFailedException e) {
            log.warn("[BATCH API] {}", e.getMessage());
            stream.sendError(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[BATCH API] Stream failed: {}", e.getMessage(), e);
            stream.sendError(ChartJson.messageFor(e));
        } finally {
            exchange.endExchange();
        }
    }

    BatchJob parseJob(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new ConstraintViolationException("Request body must be a JSON object");
        }
        List<String> symbols = textList(body.get("symbols"));
        if (symbols.isEmpty()) {
            throw new ConstraintViolationException("symbols", "symbols must be a non-empty array");
        }
        List<String> resolutions = textList(body.get("resolutions"));
        if (resolutions.isEmpty()) {
            resolutions = List.of(ChartRequestValidator.DEFAULT_RESOLUTION);
        }

        int barsCount = ChartRequestValidator.parseBarsCount(text(body, "barsCount"));
        IndicatorSettings indicator = null;
        if (body.path("cvdEnabled").asBoolean(false)) {
            String anchor = text(body, "cvdAnchorPeriod");
            String delta = text(body, "cvdTimeframe");
            indicator = new IndicatorSettings(
                anchor == null || anchor.isEmpty() ? IndicatorSettings.DEFAULT_ANCHOR_PERIOD : anchor,
                delta == null || delta.isEmpty() ? null : delta);
        }

        return new BatchJob(symbols, resolutions, barsCount, indicator,
            body.path("batchSize").asInt(config.batchSize()),
            body.path("parallelConnections").asInt(config.parallelConnections()));
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText("").trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        }
        return values;
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    /**
     * Writes SSE frames and stops writing once the client has gone away.
     */
    private static final class EventStream {
        private final OutputStream out;
        private boolean closed = false;

        EventStream(OutputStream out) {
            this.out = out;
        }

        void send(String type, JsonNode data) {
            if (closed) {
                return;
            }
            ObjectNode envelope = MAPPER.createObjectNode();
            envelope.put("type", type);
            envelope.set("data", data);
            try {
                out.write(("data: " + envelope + "\n\n").getBytes(StandardCharsets.UTF_8));
                out.flush();
            } catch (IOException e) {
                closed = true;
                log.warn("[BATCH API] Client disconnected, dropping further events: {}", e.getMessage());
            }
        }

        void sendError(String message) {
            ObjectNode error = MAPPER.createObjectNode();
            error.put("message", message);
            send("error", error);
        }
    }
}
