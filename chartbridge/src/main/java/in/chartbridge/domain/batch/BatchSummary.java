package in.chartbridge.domain.batch;

/**
 * Totals for a finished batch job.
 */
public record BatchSummary(
        int totalSymbols,
        int totalCharts,
        int successfulCharts,
        int failedCharts,
        long totalDurationMs,
        long avgChartDurationMs) {
}
