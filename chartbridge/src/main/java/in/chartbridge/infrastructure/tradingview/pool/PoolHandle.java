package in.chartbridge.infrastructure.tradingview.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One acquisition of the shared pool, bound to the caller's token.
 *
 * Closing the handle releases the acquisition exactly once.
 * <pre>
 * try (PoolHandle handle = manager.acquire(jwt)) {
 *     try (ConnectionLease lease = handle.lease()) { ... }
 * }
 * </pre>
 */
public class PoolHandle implements AutoCloseable {

    private final PersistentConnectionManager manager;
    private final ChartConnectionPool pool;
    private final String jwt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    PoolHandle(PersistentConnectionManager manager, ChartConnectionPool pool, String jwt) {
        this.manager = manager;
        this.pool = pool;
        this.jwt = jwt;
    }

    public ConnectionLease lease() {
        if (released.get()) {
            throw new IllegalStateException("Pool handle already released");
        }
        return pool.lease(jwt);
    }

    public ChartConnectionPool pool() {
        return pool;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release();
        }
    }
}
