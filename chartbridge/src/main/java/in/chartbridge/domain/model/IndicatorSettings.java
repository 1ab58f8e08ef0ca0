package in.chartbridge.domain.model;

/**
 * Cumulative Volume Delta settings for one chart.
 *
 * @param anchorPeriod   aggregation window (1W, 1M, 3M, 6M, 12M)
 * @param deltaTimeframe finer sampling interval, or null to let the study use the chart's own
 */
public record IndicatorSettings(String anchorPeriod, String deltaTimeframe) {

    public static final String DEFAULT_ANCHOR_PERIOD = "3M";

    public static IndicatorSettings defaults() {
        return new IndicatorSettings(DEFAULT_ANCHOR_PERIOD, null);
    }

    public boolean hasDeltaTimeframe() {
        return deltaTimeframe != null && !deltaTimeframe.isEmpty();
    }
}
