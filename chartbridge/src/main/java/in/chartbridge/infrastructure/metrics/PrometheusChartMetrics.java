package in.chartbridge.infrastructure.metrics;

import in.chartbridge.infrastructure.tradingview.session.SessionTransition;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of ChartMetrics.
 *
 * Exposes chart acquisition metrics in Prometheus format for scraping at /metrics.
 *
 * Key Metrics:
 * - tv_session_transitions_total{from, to} - State machine transitions
 * - tv_session_phase_seconds{phase} - Time spent in connect/auth/resolve/series/wait
 * - tv_pool_leases_total{outcome} - Lease outcomes
 * - tv_pool_lease_wait_seconds - Time callers waited for a lease
 * - tv_pool_retirements_total{reason} - Discarded connections
 * - tv_pool_connections{state} - Idle and busy pooled connections
 * - tv_batch_pairs_total{outcome} - Chart pairs fetched by batch jobs
 * - tv_batch_duration_seconds - Batch (group) duration
 */
public class PrometheusChartMetrics implements ChartMetrics {

    private final CollectorRegistry registry;

    // Session metrics
    private final Counter transitionCounter;
    private final Histogram phaseLatency;

    // Pool metrics
    private final Counter leaseCounter;
    private final Histogram leaseWait;
    private final Counter retirementCounter;
    private final Gauge poolConnections;

    // Batch metrics
    private final Counter pairCounter;
    private final Histogram batchDuration;

    public PrometheusChartMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusChartMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.transitionCounter = Counter.build()
            .name("tv_session_transitions_total")
            .help("Total number of chart session state transitions")
            .labelNames("from", "to")
            .register(registry);

        this.phaseLatency = Histogram.build()
            .name("tv_session_phase_seconds")
            .help("Time spent per chart session phase in seconds")
            .labelNames("phase")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.leaseCounter = Counter.build()
            .name("tv_pool_leases_total")
            .help("Total number of pool lease attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.leaseWait = Histogram.build()
            .name("tv_pool_lease_wait_seconds")
            .help("Time spent waiting for a pool lease in seconds")
            .buckets(0.001, 0.01, 0.1, 0.5, 1.0, 5.0, 30.0)
            .register(registry);

        this.retirementCounter = Counter.build()
            .name("tv_pool_retirements_total")
            .help("Total number of pooled connections discarded")
            .labelNames("reason")
            .register(registry);

        this.poolConnections = Gauge.build()
            .name("tv_pool_connections")
            .help("Pooled connections by state")
            .labelNames("state")
            .register(registry);

        this.pairCounter = Counter.build()
            .name("tv_batch_pairs_total")
            .help("Total number of symbol/resolution pairs fetched by batch jobs")
            .labelNames("outcome")
            .register(registry);

        this.batchDuration = Histogram.build()
            .name("tv_batch_duration_seconds")
            .help("Duration of one batch of chart fetches in seconds")
            .buckets(1, 2, 5, 10, 20, 30, 60, 120)
            .register(registry);
    }

    @Override
    public void onTransition(SessionTransition transition) {
        transitionCounter.labels(transition.from().name(), transition.to().name()).inc();
        String phase = transition.from().phase();
        if (phase != null) {
            phaseLatency.labels(phase).observe(seconds(transition.elapsed()));
        }
    }

    @Override
    public void recordLease(String outcome, Duration wait) {
        leaseCounter.labels(outcome).inc();
        leaseWait.observe(seconds(wait));
    }

    @Override
    public void recordRetirement(String reason) {
        retirementCounter.labels(reason).inc();
    }

    @Override
    public void updatePoolOccupancy(int idle, int busy) {
        poolConnections.labels("idle").set(idle);
        poolConnections.labels("busy").set(busy);
    }

    @Override
    public void recordPairResult(boolean success) {
        pairCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordBatchDuration(Duration duration) {
        batchDuration.observe(seconds(duration));
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
