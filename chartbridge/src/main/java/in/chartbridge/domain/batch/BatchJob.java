package in.chartbridge.domain.batch;

import in.chartbridge.domain.model.ChartRequest;
import in.chartbridge.domain.model.IndicatorSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of a batch fetch: every symbol at every resolution.
 *
 * Pairs are ordered symbol-major ({@code A/1D, A/60, B/1D, B/60}) and split into
 * groups of {@code batchSize}; each group produces one progress event.
 *
 * @param indicator           CVD settings applied to every pair, or null for bars only
 * @param batchSize           pairs per progress event
 * @param parallelConnections concurrent sessions used within a group
 */
public record BatchJob(
        List<String> symbols,
        List<String> resolutions,
        int barsCount,
        IndicatorSettings indicator,
        int batchSize,
        int parallelConnections) {

    public BatchJob {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols must not be empty");
        }
        if (resolutions == null || resolutions.isEmpty()) {
            throw new IllegalArgumentException("resolutions must not be empty");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (parallelConnections < 1) {
            throw new IllegalArgumentException("parallelConnections must be at least 1");
        }
        symbols = List.copyOf(symbols);
        resolutions = List.copyOf(resolutions);
    }

    public List<ChartPair> pairs() {
        List<ChartPair> pairs = new ArrayList<>(symbols.size() * resolutions.size());
        for (String symbol : symbols) {
            for (String resolution : resolutions) {
                pairs.add(new ChartPair(symbol, resolution));
            }
        }
        return pairs;
    }

    /**
     * Consecutive groups of at most {@code batchSize} pairs, in pair order.
     */
    public List<List<ChartPair>> groups() {
        List<ChartPair> pairs = pairs();
        List<List<ChartPair>> groups = new ArrayList<>();
        for (int i = 0; i < pairs.size(); i += batchSize) {
            groups.add(List.copyOf(pairs.subList(i, Math.min(pairs.size(), i + batchSize))));
        }
        return groups;
    }

    public int totalPairs() {
        return symbols.size() * resolutions.size();
    }

    public ChartRequest requestFor(ChartPair pair) {
        return new ChartRequest(pair.symbol(), pair.resolution(), barsCount, indicator);
    }
}
