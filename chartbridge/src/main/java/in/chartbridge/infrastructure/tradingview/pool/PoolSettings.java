package in.chartbridge.infrastructure.tradingview.pool;

import in.chartbridge.config.TradingViewConfig;

import java.time.Duration;

/**
 * @param capacity               maximum connections open at once (idle + busy + connecting)
 * @param staleRequestThreshold  requests served after which a connection is retired
 * @param leaseTimeout           longest a caller may wait in the lease queue
 * @param connectRetryAttempts   attempts to open a fresh connection before the lease fails
 * @param connectRetryDelay      first backoff delay between those attempts
 */
public record PoolSettings(
        int capacity,
        int staleRequestThreshold,
        Duration leaseTimeout,
        int connectRetryAttempts,
        Duration connectRetryDelay) {

    public PoolSettings {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        if (staleRequestThreshold < 1) {
            throw new IllegalArgumentException("Stale request threshold must be at least 1");
        }
        if (connectRetryAttempts < 1) {
            throw new IllegalArgumentException("Connect retry attempts must be at least 1");
        }
    }

    public static PoolSettings from(TradingViewConfig config) {
        return new PoolSettings(
            config.poolCapacity(),
            config.staleRequestThreshold(),
            config.leaseTimeout(),
            config.connectRetryAttempts(),
            Duration.ofSeconds(1));
    }

    public PoolSettings withCapacity(int newCapacity) {
        return new PoolSettings(newCapacity, staleRequestThreshold, leaseTimeout,
            connectRetryAttempts, connectRetryDelay);
    }
}
