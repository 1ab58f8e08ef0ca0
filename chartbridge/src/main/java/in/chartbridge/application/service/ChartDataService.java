package in.chartbridge.application.service;

import in.chartbridge.domain.model.ChartData;
import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.StudyScript;
import in.chartbridge.infrastructure.tradingview.indicator.IndicatorConfigProvider;
import in.chartbridge.infrastructure.tradingview.pool.ConnectionLease;
import in.chartbridge.infrastructure.tradingview.pool.PersistentConnectionManager;
import in.chartbridge.infrastructure.tradingview.pool.PoolHandle;
import in.chartbridge.service.validation.ChartRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single chart fetch through the shared connection pool.
 *
 * Failures surface as typed exceptions the caller can branch on:
 * - {@code ConstraintViolationException}: bad parameters, nothing was sent
 * - {@code RequestRejectedException}: unknown symbol, bad resolution or no bars
 * - {@code SessionExpiredException}: the JWT was refused, refresh and retry
 * - {@code TransportException}: the connection failed, a plain retry may succeed
 * - {@code PoolExhaustedException}: no connection became free in time
 */
public class ChartDataService {
    private static final Logger log = LoggerFactory.getLogger(ChartDataService.class);

    private final PersistentConnectionManager connectionManager;
    private final IndicatorConfigProvider indicatorConfig;

    public ChartDataService(PersistentConnectionManager connectionManager, IndicatorConfigProvider indicatorConfig) {
        this.connectionManager = connectionManager;
        this.indicatorConfig = indicatorConfig;
    }

    public ChartData fetch(String jwt, ChartRequest request) {
        ChartRequestValidator.validate(request);

        StudyScript script = null;
        String indicatorError = null;
        if (request.wantsIndicator()) {
            try {
                script = indicatorConfig.getScript();
            } catch (RuntimeException e) {
                indicatorError = "Indicator config unavailable: " + e.getMessage();
                log.warn("[CHART DATA] {} for {}; returning bars only", indicatorError, request.symbol());
            }
        }

        long start = System.currentTimeMillis();
        try (PoolHandle handle = connectionManager.acquire(jwt);
             ConnectionLease lease = handle.lease()) {
            ChartData data = lease.fetch(request, script);
            log.info("[CHART DATA] {} {}: {} bars in {} ms (connection {}{})",
                request.symbol(), request.resolution(), data.bars().size(),
                System.currentTimeMillis() - start, lease.connectionId(), lease.isReused() ? ", reused" : "");
            return indicatorError != null ? data.withIndicatorError(indicatorError) : data;
        }
    }
}
