package in.chartbridge.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.application.service.BatchChartFetcher;
import in.chartbridge.application.service.ChartDataService;
import in.chartbridge.config.TradingViewConfig;
import in.chartbridge.infrastructure.metrics.PrometheusChartMetrics;
import in.chartbridge.infrastructure.metrics.PrometheusMetricsHandler;
import in.chartbridge.infrastructure.tradingview.indicator.ChartPageIndicatorConfigProvider;
import in.chartbridge.infrastructure.tradingview.indicator.IndicatorConfigProvider;
import in.chartbridge.infrastructure.tradingview.pool.ChartConnectionPool;
import in.chartbridge.infrastructure.tradingview.pool.PersistentConnectionManager;
import in.chartbridge.infrastructure.tradingview.pool.PoolSettings;
import in.chartbridge.infrastructure.tradingview.protocol.TvCommands;
import in.chartbridge.infrastructure.tradingview.protocol.TvMessageParser;
import in.chartbridge.infrastructure.tradingview.session.ChartSessionFactory;
import in.chartbridge.infrastructure.tradingview.session.LoggingSessionObserver;
import in.chartbridge.infrastructure.tradingview.session.SessionFactory;
import in.chartbridge.infrastructure.tradingview.session.SessionObserver;
import in.chartbridge.infrastructure.tradingview.session.SessionTimeouts;
import in.chartbridge.infrastructure.tradingview.transport.JdkWebSocketTransport;
import in.chartbridge.transport.http.BatchStreamHandler;
import in.chartbridge.transport.http.ChartApiHandlers;
import in.chartbridge.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Service entry point (no framework).
 *
 * Wires:
 * - one {@link PersistentConnectionManager} owning the shared TradingView pool
 * - single chart and batch streaming endpoints on Undertow
 * - Prometheus metrics at /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== chartbridge starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        TradingViewConfig config = TradingViewConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusChartMetrics metrics = new PrometheusChartMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // TradingView sessions and the shared pool
        // ═══════════════════════════════════════════════════════════════
        ObjectMapper mapper = new ObjectMapper();
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .build();
        ScheduledExecutorService sessionTimers = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "TvSession-timer");
            t.setDaemon(true);
            return t;
        });

        SessionFactory sessionFactory = new ChartSessionFactory(
            JdkWebSocketTransport.factory(httpClient, config),
            new TvMessageParser(mapper),
            new TvCommands(mapper),
            SessionTimeouts.from(config),
            SessionObserver.composite(new LoggingSessionObserver(), metrics),
            sessionTimers);

        PoolSettings poolSettings = PoolSettings.from(config);
        PersistentConnectionManager connectionManager = new PersistentConnectionManager(
            () -> new ChartConnectionPool("shared", poolSettings, sessionFactory, metrics),
            config.idleGracePeriod());
        log.info("✓ Connection manager ready (capacity={}, staleThreshold={}, idleGrace={}s)",
            config.poolCapacity(), config.staleRequestThreshold(), config.idleGracePeriod().toSeconds());

        IndicatorConfigProvider indicatorConfig = new ChartPageIndicatorConfigProvider(
            httpClient, config.sessionCookie(), config.sessionCookieSign());
        if (config.sessionCookie().isEmpty()) {
            log.warn("TV_SESSION_ID not set: CVD requests will return bars without the indicator");
        }

        // ═══════════════════════════════════════════════════════════════
        // Services and routes
        // ═══════════════════════════════════════════════════════════════
        ChartDataService chartDataService = new ChartDataService(connectionManager, indicatorConfig);
        BatchChartFetcher batchFetcher = new BatchChartFetcher(indicatorConfig,
            capacity -> new ChartConnectionPool("batch", poolSettings.withCapacity(capacity), sessionFactory, metrics),
            metrics);

        ChartApiHandlers api = new ChartApiHandlers(chartDataService, connectionManager);
        BatchStreamHandler batchStream = new BatchStreamHandler(batchFetcher, connectionManager, config);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/chart-data", api::chartData)
            .post("/api/chart-data/batch", batchStream)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "chartbridge\n\n" +
                    "GET  /api/health\n" +
                    "GET  /api/chart-data?symbol=NSE:TCS&resolution=1D&barsCount=300\n" +
                    "POST /api/chart-data/batch (text/event-stream)\n" +
                    "GET  /metrics\n");
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(cors(routes))
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            connectionManager.shutdown();
            sessionTimers.shutdownNow();
        }, "shutdown"));

        server.start();
        log.info("✓ HTTP API server started on port {}", port);
    }

    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private App() {}
}
