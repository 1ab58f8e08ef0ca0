package in.chartbridge.infrastructure.tradingview.pool;

import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.tradingview.session.ChartSession;
import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;
import in.chartbridge.infrastructure.tradingview.transport.TransportException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of one pooled chart session until released.
 *
 * Use with try-with-resources; release happens exactly once no matter how often
 * {@link #close()} is called.
 * <pre>
 * try (ConnectionLease lease = pool.lease(jwt)) {
 *     ChartData data = lease.fetch(request, null);
 * }
 * </pre>
 */
public class ConnectionLease implements AutoCloseable {

    private final ChartConnectionPool pool;
    private final PooledConnection connection;
    private final boolean reused;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean unhealthy = false;

    ConnectionLease(ChartConnectionPool pool, PooledConnection connection, boolean reused) {
        this.pool = pool;
        this.connection = connection;
        this.reused = reused;
    }

    public ChartSession session() {
        return connection.session();
    }

    /**
     * Fetch through the leased session. Transport failures and token rejection mark the
     * lease unhealthy so the connection is discarded on release.
     */
    public ChartData fetch(ChartRequest request, StudyScript script) {
        try {
            return connection.session().fetchSync(request, script);
        } catch (TransportException | SessionExpiredException e) {
            unhealthy = true;
            throw e;
        }
    }

    public boolean isUnhealthy() {
        return unhealthy;
    }

    /**
     * @return true if the connection had served an earlier lease
     */
    public boolean isReused() {
        return reused;
    }

    public String connectionId() {
        return connection.id();
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.release(this);
        }
    }

    @Override
    public void close() {
        release();
    }

    PooledConnection connection() {
        return connection;
    }
}
