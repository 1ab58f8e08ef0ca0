package in.chartbridge.config;

import in.chartbridge.util.Env;

import java.time.Duration;

/**
 * Settings for the TradingView socket, pool and batch layers.
 *
 * Every value can be overridden through the environment (see {@link #fromEnv()}).
 * {@code sessionCookie} and {@code sessionCookieSign} are the browser cookies used only to
 * discover the indicator script; chart data itself is fetched with the caller's JWT.
 */
public record TradingViewConfig(
        String wsUrl,
        String chartId,
        String origin,
        Duration connectTimeout,
        Duration resolveTimeout,
        Duration seriesTimeout,
        Duration studyTimeout,
        Duration idleBarWait,
        int poolCapacity,
        int staleRequestThreshold,
        Duration leaseTimeout,
        Duration idleGracePeriod,
        int batchSize,
        int parallelConnections,
        int connectRetryAttempts,
        String sessionCookie,
        String sessionCookieSign) {

    public static final String DEFAULT_WS_URL = "wss://prodata.tradingview.com/socket.io/websocket";
    public static final String DEFAULT_CHART_ID = "S09yY40x";
    public static final String DEFAULT_ORIGIN = "https://www.tradingview.com";

    public TradingViewConfig {
        if (poolCapacity < 1) {
            throw new IllegalArgumentException("Pool capacity must be at least 1");
        }
        if (staleRequestThreshold < 1) {
            throw new IllegalArgumentException("Stale request threshold must be at least 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
        if (parallelConnections < 1) {
            throw new IllegalArgumentException("Parallel connections must be at least 1");
        }
    }

    public static TradingViewConfig fromEnv() {
        return new TradingViewConfig(
            Env.get("TV_WS_URL", DEFAULT_WS_URL),
            Env.get("TV_CHART_ID", DEFAULT_CHART_ID),
            Env.get("TV_ORIGIN", DEFAULT_ORIGIN),
            Env.getMillis("TV_CONNECT_TIMEOUT_MS", 10_000),
            Env.getMillis("TV_RESOLVE_TIMEOUT_MS", 5_000),
            Env.getMillis("TV_SERIES_TIMEOUT_MS", 15_000),
            Env.getMillis("TV_STUDY_TIMEOUT_MS", 30_000),
            Env.getMillis("TV_IDLE_BAR_WAIT_MS", 1_500),
            Env.getInt("TV_POOL_CAPACITY", 10),
            Env.getInt("TV_STALE_REQUEST_THRESHOLD", 20),
            Env.getMillis("TV_LEASE_TIMEOUT_MS", 60_000),
            Env.getMillis("TV_IDLE_GRACE_MS", 120_000),
            Env.getInt("TV_BATCH_SIZE", 18),
            Env.getInt("TV_PARALLEL_CONNECTIONS", 5),
            Env.getInt("TV_CONNECT_RETRY_ATTEMPTS", 3),
            Env.get("TV_SESSION_ID", ""),
            Env.get("TV_SESSION_ID_SIGN", ""));
    }

    /**
     * Defaults without consulting the environment.
     */
    public static TradingViewConfig defaults() {
        return new TradingViewConfig(
            DEFAULT_WS_URL, DEFAULT_CHART_ID, DEFAULT_ORIGIN,
            Duration.ofSeconds(10), Duration.ofSeconds(5), Duration.ofSeconds(15),
            Duration.ofSeconds(30), Duration.ofMillis(1_500),
            10, 20, Duration.ofSeconds(60), Duration.ofMinutes(2),
            18, 5, 3, "", "");
    }
}
