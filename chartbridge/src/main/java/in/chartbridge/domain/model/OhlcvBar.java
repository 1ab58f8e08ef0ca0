package in.chartbridge.domain.model;

/**
 * One OHLCV bar as delivered by a series update.
 *
 * TradingView sends prices and volume as JSON floats, so doubles are kept as-is.
 * {@code time} is epoch seconds and unique per symbol+resolution.
 */
public record OhlcvBar(
        long time,
        double open,
        double high,
        double low,
        double close,
        double volume) {
}
