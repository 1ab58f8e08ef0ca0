package in.chartbridge.domain.model;

import java.util.List;

/**
 * One indicator (study) sample: epoch-seconds time plus the plot values in study order.
 */
public record IndicatorPoint(long time, List<Double> values) {

    public IndicatorPoint {
        values = List.copyOf(values);
    }
}
