package in.chartbridge.service.validation;

import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.IndicatorSettings;

import java.util.regex.Pattern;

/**
 * Turns raw request parameters into a {@link ChartRequest}, applying defaults.
 *
 * Rules:
 * - symbol: required, e.g. {@code NSE:RELIANCE}, {@code BINANCE:BTCUSDT.P}
 * - resolution: defaults to {@code 1D}; seconds, minutes, D, W or M tokens
 * - barsCount: defaults to 300, integer between 1 and 2000
 * - indicator: anchor defaults to 3M, delta optional and checked against the resolution
 */
public final class ChartRequestValidator {

    public static final String DEFAULT_RESOLUTION = "1D";
    public static final int DEFAULT_BARS_COUNT = 300;
    public static final int MIN_BARS_COUNT = 1;
    public static final int MAX_BARS_COUNT = 2000;

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Za-z0-9_:.!&-]{1,64}$");
    private static final Pattern RESOLUTION_PATTERN = Pattern.compile("^\\d{0,4}[SDWM]?$");

    private ChartRequestValidator() {
    }

    /**
     * @param indicatorEnabled whether CVD was requested; anchor and delta are ignored otherwise
     * @throws ConstraintViolationException naming the first field that failed
     */
    public static ChartRequest fromParams(String symbol,
                                          String resolution,
                                          String barsCount,
                                          boolean indicatorEnabled,
                                          String anchorPeriod,
                                          String deltaTimeframe) {
        String res = isBlank(resolution) ? DEFAULT_RESOLUTION : resolution.trim();
        IndicatorSettings indicator = null;
        if (indicatorEnabled) {
            indicator = new IndicatorSettings(
                isBlank(anchorPeriod) ? IndicatorSettings.DEFAULT_ANCHOR_PERIOD : anchorPeriod.trim(),
                isBlank(deltaTimeframe) ? null : deltaTimeframe.trim());
        }
        ChartRequest request = new ChartRequest(
            symbol == null ? null : symbol.trim(), res, parseBarsCount(barsCount), indicator);
        validate(request);
        return request;
    }

    /**
     * @return the parsed count, or the default when {@code raw} is blank
     */
    public static int parseBarsCount(String raw) {
        if (isBlank(raw)) {
            return DEFAULT_BARS_COUNT;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConstraintViolationException("barsCount", barsCountMessage());
        }
        requireBarsCount(value);
        return value;
    }

    public static void validate(ChartRequest request) {
        if (isBlank(request.symbol())) {
            throw new ConstraintViolationException("symbol", "symbol is required");
        }
        if (!SYMBOL_PATTERN.matcher(request.symbol()).matches()) {
            throw new ConstraintViolationException("symbol", "Invalid symbol: \"" + request.symbol() + "\"");
        }
        if (isBlank(request.resolution()) || !RESOLUTION_PATTERN.matcher(request.resolution()).matches()) {
            throw new ConstraintViolationException("resolution",
                "Invalid resolution: \"" + request.resolution() + "\"");
        }
        requireBarsCount(request.barsCount());
        if (request.wantsIndicator()) {
            TimeframeConstraintValidator.requireValid(request.resolution(), request.indicator());
        }
    }

    private static void requireBarsCount(int value) {
        if (value < MIN_BARS_COUNT || value > MAX_BARS_COUNT) {
            throw new ConstraintViolationException("barsCount", barsCountMessage());
        }
    }

    private static String barsCountMessage() {
        return "barsCount must be between " + MIN_BARS_COUNT + " and " + MAX_BARS_COUNT;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
