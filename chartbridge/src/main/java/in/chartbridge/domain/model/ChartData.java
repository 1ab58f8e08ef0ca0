package in.chartbridge.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Bars, symbol metadata and indicator series fetched for one chart.
 *
 * @param metadata   the resolved-symbol object as sent by the server
 * @param indicators     indicator samples keyed by indicator name ({@code cvd})
 * @param indicatorError why a requested indicator is missing, or null
 */
public record ChartData(
        String symbol,
        String resolution,
        List<OhlcvBar> bars,
        JsonNode metadata,
        Map<String, List<IndicatorPoint>> indicators,
        String indicatorError) {

    public ChartData {
        bars = List.copyOf(bars);
        indicators = Map.copyOf(indicators);
    }

    public ChartData withIndicatorError(String error) {
        return new ChartData(symbol, resolution, bars, metadata, indicators, error);
    }
}
