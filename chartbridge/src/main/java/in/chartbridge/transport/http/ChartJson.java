package in.chartbridge.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.chartbridge.domain.batch.BatchProgressEvent;
import in.chartbridge.domain.batch.PairResult;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.infrastructure.tradingview.pool.PoolExhaustedException;
import in.chartbridge.infrastructure.tradingview.session.RequestRejectedException;
import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;
import in.chartbridge.infrastructure.tradingview.transport.TransportException;
import in.chartbridge.service.validation.ConstraintViolationException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;

/**
 * JSON bodies and error status mapping shared by the HTTP handlers.
 */
final class ChartJson {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // JSON Response Keys
    static final String JSON_SUCCESS = "success";
    static final String JSON_DATA = "data";
    static final String JSON_ERROR = "error";
    static final String JSON_CODE = "code";

    private ChartJson() {
    }

    static ObjectNode chart(ChartData data) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("symbol", data.symbol());
        node.put("resolution", data.resolution());
        node.set("bars", MAPPER.valueToTree(data.bars()));
        node.set("metadata", data.metadata());
        if (!data.indicators().isEmpty()) {
            node.set("indicators", MAPPER.valueToTree(data.indicators()));
        }
        if (data.indicatorError() != null) {
            node.put("indicatorError", data.indicatorError());
        }
        return node;
    }

    static ObjectNode pair(PairResult result) {
        if (result.isSuccess()) {
            return chart(result.data());
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("symbol", result.symbol());
        node.put("resolution", result.resolution());
        node.put(JSON_ERROR, result.error().getMessage());
        node.put(JSON_CODE, result.error().getKind().name());
        return node;
    }

    static ObjectNode batch(BatchProgressEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("batchIndex", event.batchIndex());
        node.put("totalBatches", event.totalBatches());
        node.set("symbols", MAPPER.valueToTree(event.symbols()));
        var charts = node.putArray("charts");
        for (PairResult result : event.charts()) {
            charts.add(pair(result));
        }
        node.set("progress", MAPPER.valueToTree(event.progress()));
        ObjectNode timing = node.putObject("timing");
        timing.put("startTime", event.timing().startTime().toEpochMilli());
        timing.put("endTime", event.timing().endTime().toEpochMilli());
        timing.put("durationMs", event.timing().durationMs());
        node.set("errors", MAPPER.valueToTree(event.errors()));
        return node;
    }

    /**
     * Status for a failed fetch: 400 bad input, 401 refused token, 404 unknown symbol,
     * 502 upstream connection failure, 503 pool saturated, 500 otherwise.
     */
    static int statusFor(RuntimeException error) {
        if (error instanceof ConstraintViolationException || error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof SessionExpiredException) {
            return 401;
        }
        if (error instanceof RequestRejectedException) {
            return 404;
        }
        if (error instanceof TransportException) {
            return 502;
        }
        if (error instanceof PoolExhaustedException) {
            return 503;
        }
        return 500;
    }

    static String codeFor(int status) {
        return switch (status) {
            case 400 -> "VALIDATION_ERROR";
            case 401 -> "SESSION_EXPIRED";
            case 404 -> "SYMBOL_NOT_FOUND";
            case 502 -> "UPSTREAM_ERROR";
            case 503 -> "POOL_EXHAUSTED";
            default -> "INTERNAL_ERROR";
        };
    }

    static String messageFor(RuntimeException error) {
        if (error instanceof RequestRejectedException) {
            return ((RequestRejectedException) error).getReason();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    static void send(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    static void error(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_SUCCESS, false);
        body.put(JSON_ERROR, message);
        body.put(JSON_CODE, codeFor(status));
        send(exchange, status, body);
    }

    /**
     * @return the token from {@code Authorization: Bearer <jwt>}, or null
     */
    static String bearerToken(HttpServerExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = header.substring(7).trim();
        return token.isEmpty() ? null : token;
    }
}
