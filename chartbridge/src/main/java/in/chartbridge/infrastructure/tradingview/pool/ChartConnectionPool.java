package in.chartbridge.infrastructure.tradingview.pool;

import in.chartbridge.infrastructure.metrics.ChartMetrics;
import in.chartbridge.infrastructure.tradingview.common.ConnectRetryPolicy;
import in.chartbridge.infrastructure.tradingview.session.ChartSession;
import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;
import in.chartbridge.infrastructure.tradingview.session.SessionFactory;
import in.chartbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of authenticated chart connections.
 *
 * Features:
 * - At most {@code capacity} connections open at once (idle, busy and still connecting)
 * - A connection is leased to one caller at a time
 * - Callers queue in FIFO order when every connection is busy, bounded by the lease timeout
 * - Idle connections are reused for the same token; the session switches symbol in place
 * - A connection is retired once it has served {@code staleRequestThreshold} requests,
 *   or as soon as it is released unhealthy
 * - A failed connect discards only that connection; other idle connections are untouched
 *
 * Usage:
 * <pre>
 * ChartConnectionPool pool = new ChartConnectionPool("batch", settings, sessionFactory, metrics);
 * try (ConnectionLease lease = pool.lease(jwt)) {
 *     ChartData data = lease.fetch(ChartRequest.of("NSE:TCS", "1D", 300), null);
 * }
 * pool.shutdown();
 * </pre>
 *
 * All mutation of the idle set, busy set and waiter queue happens in one critical
 * section. Futures are completed and sessions closed after it is left.
 */
public class ChartConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(ChartConnectionPool.class);

    private final String name;
    private final PoolSettings settings;
    private final SessionFactory sessionFactory;
    private final ChartMetrics metrics;
    private final ConnectRetryPolicy retryPolicy;
    private final ScheduledExecutorService timeoutScheduler;
    private final ExecutorService connectExecutor;
    private final AtomicLong connectionSeq = new AtomicLong();

    private final Object lock = new Object();
    private final ArrayDeque<PooledConnection> idle = new ArrayDeque<>();
    private final Set<PooledConnection> busy = new HashSet<>();
    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
    private int open = 0;
    private long created = 0;
    private long retired = 0;
    private long leasesGranted = 0;
    private boolean shutdown = false;

    public ChartConnectionPool(String name, PoolSettings settings, SessionFactory sessionFactory, ChartMetrics metrics) {
        this.name = name;
        this.settings = settings;
        this.retryPolicy = ConnectRetryPolicy.forPool(settings.connectRetryDelay(), settings.connectRetryAttempts());
        this.sessionFactory = sessionFactory;
        this.metrics = metrics;
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("TvPool-" + name + "-timeout"));
        this.connectExecutor = Executors.newCachedThreadPool(daemonThreads("TvPool-" + name + "-connect"));

        log.info("[POOL] [{}] Created (capacity={}, staleThreshold={}, leaseTimeout={}ms)",
            name, settings.capacity(), settings.staleRequestThreshold(), settings.leaseTimeout().toMillis());
    }

    // ═══════════════════════════════════════════════════════════════
    // Leasing
    // ═══════════════════════════════════════════════════════════════

    /**
     * Lease a session for {@code jwt}.
     *
     * Completes with a reused idle connection, a newly opened one, or, once the caller
     * has waited {@code leaseTimeout} in the queue, with {@link PoolExhaustedException}.
     * Connect failures complete it with the session's exception.
     */
    public CompletableFuture<ConnectionLease> leaseAsync(String jwt) {
        Waiter waiter = new Waiter(jwt);
        synchronized (lock) {
            if (shutdown) {
                return CompletableFuture.failedFuture(new PoolExhaustedException(name, "Pool is shut down"));
            }
            waiters.addLast(waiter);
        }
        waiter.timeoutTask = timeoutScheduler.schedule(
            () -> onLeaseTimeout(waiter), settings.leaseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        dispatch();
        return waiter.future;
    }

    /**
     * Blocking form of {@link #leaseAsync(String)}.
     */
    public ConnectionLease lease(String jwt) {
        return Futures.await(leaseAsync(jwt));
    }

    /**
     * Return a lease. Called once per lease by {@link ConnectionLease#release()}.
     */
    void release(ConnectionLease lease) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            PooledConnection connection = lease.connection();
            if (!busy.remove(connection)) {
                log.warn("[POOL] [{}] Release of unknown connection {}", name, connection.id());
                return;
            }
            int count = connection.incrementRequestCount();

            if (shutdown) {
                retireLocked(connection, "shutdown", after);
            } else if (lease.isUnhealthy() || !connection.session().isUsable()) {
                retireLocked(connection, "unhealthy", after);
            } else if (count >= settings.staleRequestThreshold()) {
                retireLocked(connection, "stale", after);
            } else {
                idle.addFirst(connection);
            }
            updateOccupancy();
        }
        runAll(after);
        dispatch();
    }

    /**
     * Serve queued callers in FIFO order until the head of the queue has to wait.
     */
    private void dispatch() {
        List<Runnable> after = new ArrayList<>();
        List<Waiter> toCreate = new ArrayList<>();
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            while (!waiters.isEmpty()) {
                Waiter waiter = waiters.peekFirst();
                if (waiter.future.isDone()) {
                    waiters.pollFirst();
                    continue;
                }

                PooledConnection connection = takeIdleFor(waiter.jwt, after);
                if (connection != null) {
                    waiters.pollFirst();
                    busy.add(connection);
                    after.add(grant(waiter, connection, true));
                    continue;
                }

                if (open < settings.capacity()) {
                    waiters.pollFirst();
                    open++;
                    toCreate.add(waiter);
                    continue;
                }

                // At capacity: an idle connection bound to another token makes room
                PooledConnection other = idle.pollLast();
                if (other != null) {
                    retireLocked(other, "token", after);
                    continue;
                }
                break;
            }
            updateOccupancy();
        }
        for (Waiter waiter : toCreate) {
            connectExecutor.execute(() -> create(waiter));
        }
        runAll(after);
    }

    private PooledConnection takeIdleFor(String jwt, List<Runnable> after) {
        Iterator<PooledConnection> it = idle.iterator();
        while (it.hasNext()) {
            PooledConnection connection = it.next();
            if (!connection.session().isUsable()) {
                it.remove();
                retireLocked(connection, "unhealthy", after);
            } else if (connection.servesToken(jwt)) {
                it.remove();
                return connection;
            }
        }
        return null;
    }

    private Runnable grant(Waiter waiter, PooledConnection connection, boolean reused) {
        leasesGranted++;
        ConnectionLease lease = new ConnectionLease(this, connection, reused);
        metrics.recordLease(reused ? "reused" : "created", waiter.waited());
        return () -> {
            ScheduledFuture<?> timeout = waiter.timeoutTask;
            if (timeout != null) {
                timeout.cancel(false);
            }
            if (!waiter.future.complete(lease)) {
                giveBack(connection);
            }
        };
    }

    private void giveBack(PooledConnection connection) {
        synchronized (lock) {
            if (!busy.remove(connection)) {
                return;
            }
            idle.addFirst(connection);
            updateOccupancy();
        }
        dispatch();
    }

    private void onLeaseTimeout(Waiter waiter) {
        boolean removed;
        synchronized (lock) {
            removed = waiters.remove(waiter);
        }
        if (removed) {
            metrics.recordLease("timeout", waiter.waited());
            log.warn("[POOL] [{}] Lease timed out after {} ms", name, settings.leaseTimeout().toMillis());
            waiter.future.completeExceptionally(new PoolExhaustedException(name,
                "No connection available within " + settings.leaseTimeout().toMillis()
                    + " ms (capacity " + settings.capacity() + ")"));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Connection creation
    // ═══════════════════════════════════════════════════════════════

    private void create(Waiter waiter) {
        for (int failures = 1; ; failures++) {
            String connectionId = name + "-" + connectionSeq.incrementAndGet();
            ChartSession session;
            try {
                session = sessionFactory.create(connectionId);
            } catch (RuntimeException e) {
                log.error("[POOL] [{}] Could not create session {}", name, connectionId, e);
                failCreation(waiter, e);
                return;
            }

            try {
                Futures.await(session.connect(waiter.jwt));
                onCreated(waiter, new PooledConnection(session, waiter.jwt));
                return;
            } catch (SessionExpiredException e) {
                session.close();
                log.warn("[POOL] [{}] Token rejected on {}: {}", name, connectionId, e.getMessage());
                failCreation(waiter, e);
                return;
            } catch (RuntimeException e) {
                session.close();
                if (!retryPolicy.shouldRetry(failures, e) || isShutdown() || waiter.future.isDone()) {
                    log.warn("[POOL] [{}] Connect failed after {} attempt(s): {}", name, failures, e.getMessage());
                    failCreation(waiter, e);
                    return;
                }
                Duration delay = retryPolicy.delayAfter(failures);
                log.warn("[POOL] [{}] Connect attempt {} failed, retrying in {} ms: {}",
                    name, failures, delay.toMillis(), e.getMessage());
                if (!sleep(delay)) {
                    failCreation(waiter, e);
                    return;
                }
            }
        }
    }

    private void onCreated(Waiter waiter, PooledConnection connection) {
        List<Runnable> after = new ArrayList<>();
        synchronized (lock) {
            created++;
            if (shutdown) {
                retireLocked(connection, "shutdown", after);
                after.add(() -> waiter.future.completeExceptionally(
                    new PoolExhaustedException(name, "Pool is shut down")));
            } else if (waiter.future.isDone()) {
                idle.addFirst(connection);
            } else {
                busy.add(connection);
                after.add(grant(waiter, connection, false));
            }
            updateOccupancy();
        }
        log.info("[POOL] [{}] Opened connection {}", name, connection.id());
        runAll(after);
        dispatch();
    }

    private void failCreation(Waiter waiter, RuntimeException error) {
        synchronized (lock) {
            open--;
            updateOccupancy();
        }
        metrics.recordLease("failed", waiter.waited());
        waiter.future.completeExceptionally(error);
        dispatch();
    }

    private void retireLocked(PooledConnection connection, String reason, List<Runnable> after) {
        open--;
        retired++;
        metrics.recordRetirement(reason);
        log.info("[POOL] [{}] Retiring {} ({}, {} requests served)",
            name, connection.id(), reason, connection.requestCount());
        after.add(() -> connection.session().close());
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close idle connections, fail queued callers and refuse new leases. Busy
     * connections are closed when their leases are released.
     */
    public void shutdown() {
        List<Runnable> after = new ArrayList<>();
        List<Waiter> pending;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            pending = new ArrayList<>(waiters);
            waiters.clear();
            for (PooledConnection connection : idle) {
                retireLocked(connection, "shutdown", after);
            }
            idle.clear();
            updateOccupancy();
        }
        for (Waiter waiter : pending) {
            waiter.future.completeExceptionally(new PoolExhaustedException(name, "Pool is shut down"));
        }
        runAll(after);
        timeoutScheduler.shutdownNow();
        connectExecutor.shutdown();
        log.info("[POOL] [{}] Shut down", name);
    }

    public boolean isShutdown() {
        synchronized (lock) {
            return shutdown;
        }
    }

    public PoolStats stats() {
        synchronized (lock) {
            return new PoolStats(settings.capacity(), open, idle.size(), busy.size(), waiters.size(),
                created, retired, leasesGranted);
        }
    }

    public String name() {
        return name;
    }

    private void updateOccupancy() {
        metrics.updatePoolOccupancy(idle.size(), busy.size());
    }

    private void runAll(List<Runnable> actions) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[POOL] [{}] Deferred action failed", name, e);
            }
        }
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class Waiter {
        final String jwt;
        final CompletableFuture<ConnectionLease> future = new CompletableFuture<>();
        final long enqueuedNanos = System.nanoTime();
        volatile ScheduledFuture<?> timeoutTask;

        Waiter(String jwt) {
            this.jwt = jwt;
        }

        Duration waited() {
            return Duration.ofNanos(System.nanoTime() - enqueuedNanos);
        }
    }
}
