package in.chartbridge.application.service;

import in.chartbridge.domain.batch.BatchJob;
import in.chartbridge.domain.batch.BatchProgressEvent;
import in.chartbridge.domain.batch.BatchSummary;
import in.chartbridge.domain.batch.ChartPair;
import in.chartbridge.domain.batch.PairFetchException;
import in.chartbridge.domain.batch.PairResult;
import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.metrics.ChartMetrics;
import in.chartbridge.infrastructure.tradingview.indicator.IndicatorConfigProvider;
import in.chartbridge.infrastructure.tradingview.pool.ChartConnectionPool;
import in.chartbridge.infrastructure.tradingview.pool.ConnectionLease;
import in.chartbridge.infrastructure.tradingview.pool.PoolHandle;
import in.chartbridge.service.validation.ChartRequestValidator;
import in.chartbridge.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/**
 * BatchChartFetcher - fetches every symbol at every resolution with bounded parallelism.
 *
 * FLOW:
 * 1. Flatten symbols x resolutions into pairs, symbol-major
 * 2. Split pairs into groups of {@code batchSize}
 * 3. Groups run one after another; within a group up to {@code parallelConnections}
 *    workers pull the next pair, lease a session, fetch and release
 * 4. After each group the listener is called before the next group starts
 *
 * FAILURES:
 * A failing pair gets a {@link PairFetchException} in its result and the job continues.
 * Invalid request or indicator settings fail the pair before any lease is taken. When the
 * indicator script cannot be discovered, bars are still fetched and each chart carries an
 * {@code indicatorError}. Only a job in which every pair failed throws
 * ({@link BatchJobFailedException}), after the last event.
 *
 * THREAD-SAFETY:
 * Workers read the immutable job and write only their own result slot.
 */
public class BatchChartFetcher {
    private static final Logger log = LoggerFactory.getLogger(BatchChartFetcher.class);

    private final IndicatorConfigProvider indicatorConfig;
    private final IntFunction<ChartConnectionPool> privatePoolFactory;
    private final ChartMetrics metrics;
    private final AtomicInteger jobSeq = new AtomicInteger();

    /**
     * @param privatePoolFactory builds a pool with the given capacity for jobs run without a shared pool
     */
    public BatchChartFetcher(IndicatorConfigProvider indicatorConfig,
                             IntFunction<ChartConnectionPool> privatePoolFactory,
                             ChartMetrics metrics) {
        this.indicatorConfig = indicatorConfig;
        this.privatePoolFactory = privatePoolFactory;
        this.metrics = metrics;
    }

    /**
     * Run the job on a private pool sized to {@code parallelConnections}, shut down afterwards.
     */
    public BatchSummary fetch(String jwt, BatchJob job, BatchProgressListener listener) {
        ChartConnectionPool pool = privatePoolFactory.apply(job.parallelConnections());
        try {
            return run(job, () -> pool.lease(jwt), listener);
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Run the job on the shared pool behind {@code handle}. The caller keeps ownership of the handle.
     */
    public BatchSummary fetch(BatchJob job, PoolHandle handle, BatchProgressListener listener) {
        return run(job, handle::lease, listener);
    }

    private BatchSummary run(BatchJob job, Supplier<ConnectionLease> leases, BatchProgressListener listener) {
        int jobId = jobSeq.incrementAndGet();
        long jobStart = System.currentTimeMillis();
        List<List<ChartPair>> groups = job.groups();
        int totalPairs = job.totalPairs();

        log.info("[BATCH] [{}] Starting: {} symbols x {} resolutions = {} charts in {} batches ({} parallel)",
            jobId, job.symbols().size(), job.resolutions().size(), totalPairs, groups.size(),
            job.parallelConnections());

        IndicatorScript script = new IndicatorScript(job.indicator() != null);
        AtomicInteger threadSeq = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(job.parallelConnections(), r -> {
            Thread t = new Thread(r, "BatchFetch-" + jobId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        int loaded = 0;
        int successful = 0;
        PairFetchException lastError = null;
        try {
            for (int g = 0; g < groups.size(); g++) {
                List<ChartPair> group = groups.get(g);
                Instant groupStart = Instant.now();

                PairResult[] results = runGroup(job, group, leases, script, workers);

                Instant groupEnd = Instant.now();
                List<String> errors = new ArrayList<>();
                Set<String> symbols = new LinkedHashSet<>();
                for (PairResult result : results) {
                    symbols.add(result.symbol());
                    metrics.recordPairResult(result.isSuccess());
                    if (result.isSuccess()) {
                        successful++;
                    } else {
                        lastError = result.error();
                        errors.add(result.pair() + ": " + result.error().getMessage());
                    }
                }
                loaded += results.length;

                BatchProgressEvent event = new BatchProgressEvent(
                    g + 1,
                    groups.size(),
                    new ArrayList<>(symbols),
                    Arrays.asList(results),
                    BatchProgressEvent.Progress.of(loaded, totalPairs),
                    new BatchProgressEvent.Timing(groupStart, groupEnd,
                        Duration.between(groupStart, groupEnd).toMillis()),
                    errors);

                log.info("[BATCH] [{}] Batch {}/{} done: {}/{} ok in {} ms",
                    jobId, g + 1, groups.size(), results.length - errors.size(), results.length,
                    event.timing().durationMs());
                notify(jobId, listener, event);
            }
        } finally {
            workers.shutdownNow();
        }

        long totalMs = System.currentTimeMillis() - jobStart;
        metrics.recordBatchDuration(Duration.ofMillis(totalMs));
        BatchSummary summary = new BatchSummary(
            job.symbols().size(),
            totalPairs,
            successful,
            totalPairs - successful,
            totalMs,
            Math.round((double) totalMs / totalPairs));

        log.info("[BATCH] [{}] Complete: {}/{} charts in {} ms (avg {} ms/chart)",
            jobId, successful, totalPairs, totalMs, summary.avgChartDurationMs());

        if (successful == 0) {
            throw new BatchJobFailedException(summary, lastError.getMessage(), lastError);
        }
        return summary;
    }

    private PairResult[] runGroup(BatchJob job,
                                  List<ChartPair> group,
                                  Supplier<ConnectionLease> leases,
                                  IndicatorScript script,
                                  ExecutorService workers) {
        PairResult[] results = new PairResult[group.size()];
        AtomicInteger next = new AtomicInteger();
        int workerCount = Math.min(job.parallelConnections(), group.size());

        List<CompletableFuture<Void>> running = new ArrayList<>(workerCount);
        for (int w = 0; w < workerCount; w++) {
            running.add(CompletableFuture.runAsync(() -> {
                int index;
                while ((index = next.getAndIncrement()) < group.size()) {
                    results[index] = fetchPair(job, group.get(index), leases, script);
                }
            }, workers));
        }
        Futures.await(CompletableFuture.allOf(running.toArray(new CompletableFuture[0])));
        return results;
    }

    private PairResult fetchPair(BatchJob job,
                                 ChartPair pair,
                                 Supplier<ConnectionLease> leases,
                                 IndicatorScript script) {
        long start = System.currentTimeMillis();
        try {
            ChartRequest request = job.requestFor(pair);
            ChartRequestValidator.validate(request);

            StudyScript study = request.wantsIndicator() ? script.get() : null;
            ChartData data;
            try (ConnectionLease lease = leases.get()) {
                data = lease.fetch(request, study);
            }
            if (request.wantsIndicator() && study == null) {
                data = data.withIndicatorError(script.error());
            }
            return PairResult.success(pair, data, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            PairFetchException error = PairErrors.classify(pair, e);
            log.warn("[BATCH] {} failed ({}): {}", pair, error.getKind(), error.getMessage());
            return PairResult.failure(error, System.currentTimeMillis() - start);
        }
    }

    private void notify(int jobId, BatchProgressListener listener, BatchProgressEvent event) {
        try {
            listener.onBatchComplete(event);
        } catch (RuntimeException e) {
            log.warn("[BATCH] [{}] Progress listener failed for batch {}: {}",
                jobId, event.batchIndex(), e.getMessage(), e);
        }
    }

    /**
     * Indicator script resolved at most once per job, on first use.
     */
    private final class IndicatorScript {
        private final boolean wanted;
        private boolean resolved;
        private StudyScript script;
        private String error;

        IndicatorScript(boolean wanted) {
            this.wanted = wanted;
        }

        /**
         * @return the script, or null when discovery failed (see {@link #error()})
         */
        synchronized StudyScript get() {
            if (!wanted) {
                return null;
            }
            if (!resolved) {
                resolved = true;
                try {
                    script = indicatorConfig.getScript();
                } catch (RuntimeException e) {
                    error = "Indicator config unavailable: " + e.getMessage();
                    log.warn("[BATCH] {}; charts will be returned without the indicator", error);
                }
            }
            return script;
        }

        synchronized String error() {
            return error;
        }
    }
}
