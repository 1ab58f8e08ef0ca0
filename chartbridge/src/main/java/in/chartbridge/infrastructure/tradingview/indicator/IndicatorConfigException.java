package in.chartbridge.infrastructure.tradingview.indicator;

/**
 * The indicator script could not be discovered. Charts are still served without the indicator.
 */
public class IndicatorConfigException extends RuntimeException {

    public IndicatorConfigException(String message) {
        super(message);
    }

    public IndicatorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
