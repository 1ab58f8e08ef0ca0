package in.chartbridge.infrastructure.tradingview.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Reference-counted owner of the one pool shared by concurrent requests.
 *
 * Request-scoped code acquires at the start and releases in a finally block (or
 * closes the returned {@link PoolHandle}); the pool outlives any single request.
 *
 * Lifecycle:
 * - first {@link #acquire(String)} builds the pool
 * - each acquire increments the ref count, each release decrements it
 * - when the count returns to zero a teardown is scheduled after the idle grace period
 * - an acquire during the grace period cancels the teardown and keeps the warm pool
 *
 * Constructed once at process start and passed to request handlers.
 */
public class PersistentConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(PersistentConnectionManager.class);

    private final Supplier<ChartConnectionPool> poolFactory;
    private final Duration idleGracePeriod;
    private final ScheduledExecutorService scheduler;

    private ChartConnectionPool pool;
    private int refCount = 0;
    private ScheduledFuture<?> teardownTask;
    private long teardownGeneration = 0;
    private long poolsCreated = 0;
    private boolean shutdown = false;

    public PersistentConnectionManager(Supplier<ChartConnectionPool> poolFactory, Duration idleGracePeriod) {
        this.poolFactory = poolFactory;
        this.idleGracePeriod = idleGracePeriod;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ConnManager-teardown");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Take a reference on the shared pool, creating it if needed.
     *
     * @param jwt token the returned handle leases with; the manager itself never refreshes it
     */
    public synchronized PoolHandle acquire(String jwt) {
        if (shutdown) {
            throw new IllegalStateException("Connection manager is shut down");
        }
        cancelTeardown();
        if (pool == null) {
            pool = poolFactory.get();
            poolsCreated++;
            log.info("[CONN MANAGER] Pool {} created", pool.name());
        }
        refCount++;
        log.debug("[CONN MANAGER] Acquired (refCount={})", refCount);
        return new PoolHandle(this, pool, jwt);
    }

    /**
     * Drop one reference. Prefer closing the {@link PoolHandle}, which calls this once.
     */
    public synchronized void release() {
        if (refCount == 0) {
            log.warn("[CONN MANAGER] release() without matching acquire()");
            return;
        }
        refCount--;
        log.debug("[CONN MANAGER] Released (refCount={})", refCount);
        if (refCount == 0 && pool != null && !shutdown) {
            scheduleTeardown();
        }
    }

    public synchronized int getRefCount() {
        return refCount;
    }

    public synchronized boolean hasPool() {
        return pool != null;
    }

    public synchronized long getPoolsCreated() {
        return poolsCreated;
    }

    /**
     * @return stats of the live pool, or null when none exists
     */
    public synchronized PoolStats poolStats() {
        return pool == null ? null : pool.stats();
    }

    /**
     * Tear the pool down now regardless of the ref count, and refuse further acquires.
     */
    public void shutdown() {
        ChartConnectionPool toClose;
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            cancelTeardown();
            toClose = pool;
            pool = null;
        }
        if (toClose != null) {
            toClose.shutdown();
        }
        scheduler.shutdownNow();
        log.info("[CONN MANAGER] Shut down");
    }

    private void scheduleTeardown() {
        long generation = ++teardownGeneration;
        teardownTask = scheduler.schedule(() -> teardownIfIdle(generation),
            idleGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("[CONN MANAGER] Teardown scheduled in {} ms", idleGracePeriod.toMillis());
    }

    private void cancelTeardown() {
        teardownGeneration++;
        if (teardownTask != null) {
            teardownTask.cancel(false);
            teardownTask = null;
        }
    }

    private void teardownIfIdle(long generation) {
        ChartConnectionPool toClose;
        synchronized (this) {
            if (generation != teardownGeneration || refCount > 0 || pool == null) {
                return;
            }
            toClose = pool;
            pool = null;
            teardownTask = null;
        }
        log.info("[CONN MANAGER] Idle for {} ms, tearing down pool {}", idleGracePeriod.toMillis(), toClose.name());
        toClose.shutdown();
    }
}
