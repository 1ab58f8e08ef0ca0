package in.chartbridge.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.application.service.BatchChartFetcher;
import in.chartbridge.application.service.ChartDataService;
import in.chartbridge.config.TradingViewConfig;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.OhlcvBar;
import in.chartbridge.infrastructure.metrics.ChartMetrics;
import in.chartbridge.infrastructure.tradingview.indicator.IndicatorConfigException;
import in.chartbridge.infrastructure.tradingview.pool.ChartConnectionPool;
import in.chartbridge.infrastructure.tradingview.pool.PersistentConnectionManager;
import in.chartbridge.infrastructure.tradingview.pool.PoolSettings;
import in.chartbridge.infrastructure.tradingview.session.ChartSession;
import in.chartbridge.infrastructure.tradingview.session.RequestRejectedException;
import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;
import in.chartbridge.infrastructure.tradingview.session.SessionFactory;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Integration test for the chart HTTP endpoints.
 *
 * Tests:
 * - Health reports the connection manager
 * - Single chart: success, missing token, bad parameters, unknown symbol, refused token
 * - Batch stream: SSE events in order, request validation
 *
 * Runs a real Undertow server; TradingView sessions are mocks.
 */
public class ChartApiHandlersTest {

    private static final int TEST_PORT = 19091;
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private PersistentConnectionManager connectionManager;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        PoolSettings settings = new PoolSettings(3, 20, Duration.ofSeconds(5), 1, Duration.ofMillis(10));
        connectionManager = new PersistentConnectionManager(
            () -> new ChartConnectionPool("shared", settings, sessionFactory(), ChartMetrics.NOOP),
            Duration.ofSeconds(30));

        ChartDataService chartDataService = new ChartDataService(connectionManager, () -> {
            throw new IndicatorConfigException("No TradingView session cookie configured (TV_SESSION_ID)");
        });
        BatchChartFetcher batchFetcher = new BatchChartFetcher(
            () -> {
                throw new IndicatorConfigException("unused");
            },
            capacity -> new ChartConnectionPool("batch", settings.withCapacity(capacity), sessionFactory(),
                ChartMetrics.NOOP),
            ChartMetrics.NOOP);

        ChartApiHandlers api = new ChartApiHandlers(chartDataService, connectionManager);
        BatchStreamHandler batchStream = new BatchStreamHandler(batchFetcher, connectionManager,
            TradingViewConfig.defaults());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/health", api::health)
                .get("/api/chart-data", api::chartData)
                .post("/api/chart-data/batch", batchStream))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
        connectionManager.shutdown();
    }

    @Test
    public void testHealth() throws Exception {
        HttpResponse<String> response = get("/api/health", null);

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ok", body.get("status").asText());
        assertEquals(0, body.path("connectionManager").path("refCount").asInt());
        assertTrue(body.path("connectionManager").path("pool").isNull(), "no pool before the first request");
    }

    @Test
    public void testChartDataSuccess() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=NSE:TCS&resolution=60&barsCount=2", "jwt");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertTrue(body.get("success").asBoolean());
        JsonNode data = body.get("data");
        assertEquals("NSE:TCS", data.get("symbol").asText());
        assertEquals("60", data.get("resolution").asText());
        assertEquals(2, data.get("bars").size());
        assertEquals(10.5, data.get("bars").get(0).get("close").asDouble(), 1e-9);
        assertFalse(data.has("indicatorError"));

        JsonNode health = MAPPER.readTree(get("/api/health", null).body());
        assertEquals(1, health.path("connectionManager").path("pool").path("created").asInt());
        assertEquals(0, health.path("connectionManager").path("refCount").asInt(), "handle released after request");
    }

    @Test
    public void testChartDataIndicatorUnavailable() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=NSE:TCS&cvdEnabled=true", "jwt");

        assertEquals(200, response.statusCode());
        JsonNode data = MAPPER.readTree(response.body()).get("data");
        assertEquals("1D", data.get("resolution").asText());
        assertTrue(data.get("indicatorError").asText().startsWith("Indicator config unavailable"));
    }

    @Test
    public void testMissingToken() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=NSE:TCS", null);

        assertEquals(401, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertFalse(body.get("success").asBoolean());
        assertEquals("Missing bearer token", body.get("error").asText());
    }

    @Test
    public void testValidationError() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=NSE:TCS&resolution=15&cvdEnabled=true"
            + "&cvdTimeframe=60", "jwt");

        assertEquals(400, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("VALIDATION_ERROR", body.get("code").asText());
        assertTrue(body.get("error").asText().contains("Valid options: 15S, 30S, 1, 5"));

        HttpResponse<String> bars = get("/api/chart-data?symbol=NSE:TCS&barsCount=5000", "jwt");
        assertEquals(400, bars.statusCode());
        assertEquals("barsCount must be between 1 and 2000", MAPPER.readTree(bars.body()).get("error").asText());
    }

    @Test
    public void testUnknownSymbol() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=BAD:GONE", "jwt");

        assertEquals(404, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("SYMBOL_NOT_FOUND", body.get("code").asText());
        assertEquals("Symbol error: invalid symbol", body.get("error").asText());
    }

    @Test
    public void testRefusedToken() throws Exception {
        HttpResponse<String> response = get("/api/chart-data?symbol=NSE:TCS", "expired");

        assertEquals(401, response.statusCode());
        assertEquals("SESSION_EXPIRED", MAPPER.readTree(response.body()).get("code").asText());
    }

    @Test
    public void testBatchStream() throws Exception {
        String body = "{\"symbols\":[\"NSE:A\",\"BAD:B\",\"NSE:C\"],\"resolutions\":[\"1D\"],"
            + "\"barsCount\":2,\"batchSize\":2,\"parallelConnections\":2}";

        HttpResponse<String> response = post("/api/chart-data/batch", body, "jwt");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));

        List<JsonNode> events = events(response.body());
        assertEquals(List.of("chart-batch", "chart-batch", "complete"),
            events.stream().map(e -> e.get("type").asText()).toList());

        JsonNode first = events.get(0).get("data");
        assertEquals(1, first.get("batchIndex").asInt());
        assertEquals(2, first.get("totalBatches").asInt());
        assertEquals(2, first.get("charts").size());
        assertEquals("REJECTED", first.get("charts").get(1).get("code").asText());
        assertEquals(67, first.path("progress").path("percentage").asInt());
        assertTrue(first.path("timing").path("startTime").isNumber());

        JsonNode complete = events.get(2).get("data");
        assertEquals(3, complete.get("totalCharts").asInt());
        assertEquals(2, complete.get("successfulCharts").asInt());
        assertEquals(1, complete.get("failedCharts").asInt());
    }

    @Test
    public void testBatchAllFailedSendsErrorEvent() throws Exception {
        HttpResponse<String> response = post("/api/chart-data/batch",
            "{\"symbols\":[\"BAD:A\"],\"batchSize\":1,\"parallelConnections\":1}", "jwt");

        List<JsonNode> events = events(response.body());
        assertEquals("chart-batch", events.get(0).get("type").asText());
        JsonNode last = events.get(events.size() - 1);
        assertEquals("error", last.get("type").asText());
        assertTrue(last.path("data").path("message").asText().startsWith("All 1 charts failed"));
    }

    @Test
    public void testBatchRequestValidation() throws Exception {
        assertEquals(401, post("/api/chart-data/batch", "{\"symbols\":[\"NSE:A\"]}", null).statusCode());

        HttpResponse<String> noSymbols = post("/api/chart-data/batch", "{\"symbols\":[]}", "jwt");
        assertEquals(400, noSymbols.statusCode());
        assertEquals("symbols must be a non-empty array", MAPPER.readTree(noSymbols.body()).get("error").asText());

        HttpResponse<String> badJson = post("/api/chart-data/batch", "{symbols", "jwt");
        assertEquals(400, badJson.statusCode());
        assertEquals("Invalid JSON body", MAPPER.readTree(badJson.body()).get("error").asText());
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    private HttpResponse<String> get(String path, String jwt) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .timeout(Duration.ofSeconds(10))
            .GET();
        if (jwt != null) {
            request.header("Authorization", "Bearer " + jwt);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String jwt) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .timeout(Duration.ofSeconds(10))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (jwt != null) {
            request.header("Authorization", "Bearer " + jwt);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static List<JsonNode> events(String body) throws Exception {
        List<JsonNode> events = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.startsWith("data: ")) {
                events.add(MAPPER.readTree(line.substring("data: ".length())));
            }
        }
        return events;
    }

    private static SessionFactory sessionFactory() {
        return connectionId -> {
            ChartSession session = mock(ChartSession.class);
            when(session.connectionId()).thenReturn(connectionId);
            when(session.isUsable()).thenReturn(true);
            when(session.connect(anyString())).thenAnswer(inv -> "expired".equals(inv.getArgument(0))
                ? CompletableFuture.failedFuture(new SessionExpiredException(connectionId, "Server rejected session"))
                : CompletableFuture.completedFuture(null));
            when(session.fetchSync(any(), any())).thenAnswer(inv -> {
                ChartRequest request = inv.getArgument(0);
                if (request.symbol().startsWith("BAD:")) {
                    throw new RequestRejectedException(connectionId, request.symbol(), "Symbol error: invalid symbol");
                }
                return new ChartData(request.symbol(), request.resolution(), List.of(
                    new OhlcvBar(1_700_000_000L, 10, 11, 9, 10.5, 1000),
                    new OhlcvBar(1_700_086_400L, 10.5, 12, 10, 11.5, 1200)), null, Map.of(), null);
            });
            return session;
        };
    }
}
