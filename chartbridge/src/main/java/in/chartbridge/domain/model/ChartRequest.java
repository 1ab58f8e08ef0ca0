package in.chartbridge.domain.model;

/**
 * A request for one symbol at one resolution.
 *
 * @param symbol     canonical symbol, e.g. {@code NSE:RELIANCE}
 * @param resolution chart timeframe token, e.g. {@code 1D}, {@code 15}, {@code 188}
 * @param barsCount  number of bars requested
 * @param indicator  CVD settings, or null when no indicator is requested
 */
public record ChartRequest(
        String symbol,
        String resolution,
        int barsCount,
        IndicatorSettings indicator) {

    public static ChartRequest of(String symbol, String resolution, int barsCount) {
        return new ChartRequest(symbol, resolution, barsCount, null);
    }

    public boolean wantsIndicator() {
        return indicator != null;
    }
}
