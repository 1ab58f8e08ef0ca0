package in.chartbridge.service.validation;

import in.chartbridge.domain.model.IndicatorSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules for Cumulative Volume Delta settings against a chart timeframe.
 *
 * Timeframe tokens:
 * - {@code 15S}, {@code 30S}: seconds
 * - {@code 1}, {@code 5}, {@code 188}: minutes, any positive integer
 * - {@code D} / {@code 1D}: one day
 * - {@code W} / {@code 1W}: one week
 *
 * Comparison is two-tier. When both tokens are in {@link #TIMEFRAME_ORDER} their ordinals
 * are compared; otherwise both are converted to minutes. A token that cannot be parsed
 * never compares as smaller, so it is always rejected.
 *
 * The delta must be strictly smaller than the chart timeframe: equal timeframes are invalid.
 */
public final class TimeframeConstraintValidator {

    public static final List<String> ANCHOR_PERIODS = List.of("1W", "1M", "3M", "6M", "12M");

    public static final List<String> DELTA_TIMEFRAMES = List.of("15S", "30S", "1", "5", "15", "30", "60", "D", "W");

    /** Ordinal of each known token. 75 and 188 are custom intraday charts. */
    public static final Map<String, Double> TIMEFRAME_ORDER;

    static {
        Map<String, Double> order = new LinkedHashMap<>();
        order.put("15S", 0.0);
        order.put("30S", 1.0);
        order.put("1", 2.0);
        order.put("5", 3.0);
        order.put("15", 4.0);
        order.put("30", 5.0);
        order.put("60", 6.0);
        order.put("75", 6.2);
        order.put("188", 6.5);
        order.put("D", 7.0);
        order.put("1D", 7.0);
        order.put("W", 8.0);
        order.put("1W", 8.0);
        TIMEFRAME_ORDER = Collections.unmodifiableMap(order);
    }

    private static final Pattern SECONDS = Pattern.compile("(\\d{1,9})S");
    private static final Pattern MINUTES = Pattern.compile("\\d{1,9}");

    private static final double MINUTES_PER_DAY = 1440;
    private static final double MINUTES_PER_WEEK = 10080;

    private static final String SHORT_CHART_DELTA = "15S";
    private static final String DEFAULT_DELTA = "1";

    private TimeframeConstraintValidator() {
    }

    /**
     * Convert a timeframe token to minutes.
     *
     * @return minutes (fractional for second tokens), or empty when the token is not recognised
     */
    public static OptionalDouble parseToMinutes(String token) {
        if (token == null) {
            return OptionalDouble.empty();
        }
        String tf = token.trim();
        if (tf.equals("D") || tf.equals("1D")) {
            return OptionalDouble.of(MINUTES_PER_DAY);
        }
        if (tf.equals("W") || tf.equals("1W")) {
            return OptionalDouble.of(MINUTES_PER_WEEK);
        }
        Matcher seconds = SECONDS.matcher(tf);
        if (seconds.matches()) {
            int value = Integer.parseInt(seconds.group(1));
            return value > 0 ? OptionalDouble.of(value / 60.0) : OptionalDouble.empty();
        }
        if (MINUTES.matcher(tf).matches()) {
            int value = Integer.parseInt(tf);
            return value > 0 ? OptionalDouble.of(value) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    /**
     * @return true iff {@code delta} is strictly shorter than {@code chart}
     */
    public static boolean isValidDelta(String delta, String chart) {
        Double deltaOrder = delta == null ? null : TIMEFRAME_ORDER.get(delta);
        Double chartOrder = chart == null ? null : TIMEFRAME_ORDER.get(chart);
        if (deltaOrder != null && chartOrder != null) {
            return deltaOrder < chartOrder;
        }

        OptionalDouble deltaMinutes = parseToMinutes(delta);
        OptionalDouble chartMinutes = parseToMinutes(chart);
        if (deltaMinutes.isPresent() && chartMinutes.isPresent()) {
            return deltaMinutes.getAsDouble() < chartMinutes.getAsDouble();
        }
        return false;
    }

    /**
     * Canonical delta timeframes usable with {@code chart}, in canonical order.
     * Empty for an unparseable chart token.
     */
    public static List<String> validDeltasFor(String chart) {
        List<String> valid = new ArrayList<>();
        for (String delta : DELTA_TIMEFRAMES) {
            if (isValidDelta(delta, chart)) {
                valid.add(delta);
            }
        }
        return valid;
    }

    public static ConstraintResult validate(String chart, String anchorPeriod, String deltaTimeframe) {
        if (!ANCHOR_PERIODS.contains(anchorPeriod)) {
            return ConstraintResult.invalid(String.format("Invalid anchor period: \"%s\". Must be one of: %s",
                anchorPeriod, String.join(", ", ANCHOR_PERIODS)));
        }
        if (deltaTimeframe == null || deltaTimeframe.isEmpty()) {
            return ConstraintResult.ok();
        }
        if (!DELTA_TIMEFRAMES.contains(deltaTimeframe)) {
            return ConstraintResult.invalid(String.format("Invalid delta timeframe: \"%s\". Must be one of: %s",
                deltaTimeframe, String.join(", ", DELTA_TIMEFRAMES)));
        }
        if (parseToMinutes(chart).isEmpty()) {
            return ConstraintResult.invalid(String.format(
                "Chart timeframe \"%s\" is not recognised, so no delta timeframe can be checked against it", chart));
        }
        if (!isValidDelta(deltaTimeframe, chart)) {
            List<String> options = validDeltasFor(chart);
            return ConstraintResult.invalid(String.format(
                "Delta timeframe \"%s\" must be less than chart timeframe \"%s\". Valid options: %s",
                deltaTimeframe, chart, options.isEmpty() ? "none" : String.join(", ", options)));
        }
        return ConstraintResult.ok();
    }

    public static ConstraintResult validate(String chart, IndicatorSettings settings) {
        return validate(chart, settings.anchorPeriod(), settings.deltaTimeframe());
    }

    /**
     * @throws ConstraintViolationException with the failed rule when the settings are invalid
     */
    public static void requireValid(String chart, IndicatorSettings settings) {
        ConstraintResult result = validate(chart, settings);
        if (!result.valid()) {
            throw new ConstraintViolationException("indicator", result.error());
        }
    }

    /**
     * Default settings for a chart: 3M anchor, 15S delta up to a 15-minute chart, 1-minute delta above.
     * The delta is dropped when the chart has no shorter canonical timeframe.
     */
    public static IndicatorSettings recommendedSettings(String chart) {
        Double order = TIMEFRAME_ORDER.get(chart);
        String delta = order != null && order <= TIMEFRAME_ORDER.get("15") ? SHORT_CHART_DELTA : DEFAULT_DELTA;
        if (!isValidDelta(delta, chart)) {
            delta = isValidDelta(SHORT_CHART_DELTA, chart) ? SHORT_CHART_DELTA : null;
        }
        return new IndicatorSettings(IndicatorSettings.DEFAULT_ANCHOR_PERIOD, delta);
    }
}
