package in.chartbridge.infrastructure.tradingview.pool;

/**
 * No connection became available within the lease timeout, or the pool is shut down.
 */
public class PoolExhaustedException extends RuntimeException {

    private final String poolName;

    public PoolExhaustedException(String poolName, String message) {
        super(String.format("[%s] %s", poolName, message));
        this.poolName = poolName;
    }

    public String getPoolName() {
        return poolName;
    }
}
