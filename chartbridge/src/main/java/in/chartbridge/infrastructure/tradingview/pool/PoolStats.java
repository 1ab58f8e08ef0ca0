package in.chartbridge.infrastructure.tradingview.pool;

/**
 * Point-in-time view of a pool.
 */
public record PoolStats(
        int capacity,
        int open,
        int idle,
        int busy,
        int waiting,
        long created,
        long retired,
        long leasesGranted) {
}
