package in.chartbridge.infrastructure.metrics;

import in.chartbridge.infrastructure.tradingview.session.SessionObserver;
import in.chartbridge.infrastructure.tradingview.session.SessionTransition;

import java.time.Duration;

/**
 * Metrics for the chart acquisition path.
 *
 * Implementations can publish to Prometheus or anything else. Every chart session
 * reports its transitions here, which gives the connect/auth/resolve/series/wait
 * latency breakdown.
 *
 * Key metrics:
 * - Session transitions and time spent per phase
 * - Pool leases (reused, created, timed out, failed) and pool occupancy
 * - Connection retirements by reason
 * - Batch pair outcomes and batch duration
 */
public interface ChartMetrics extends SessionObserver {

    ChartMetrics NOOP = new ChartMetrics() {
        @Override
        public void onTransition(SessionTransition transition) {}

        @Override
        public void recordLease(String outcome, Duration wait) {}

        @Override
        public void recordRetirement(String reason) {}

        @Override
        public void updatePoolOccupancy(int idle, int busy) {}

        @Override
        public void recordPairResult(boolean success) {}

        @Override
        public void recordBatchDuration(Duration duration) {}
    };

    /**
     * Record a granted or failed lease.
     *
     * @param outcome reused, created, timeout or failed
     * @param wait    time from the lease call until it resolved
     */
    void recordLease(String outcome, Duration wait);

    /**
     * Record a pooled connection being discarded.
     *
     * @param reason stale, unhealthy or shutdown
     */
    void recordRetirement(String reason);

    void updatePoolOccupancy(int idle, int busy);

    void recordPairResult(boolean success);

    void recordBatchDuration(Duration duration);
}
