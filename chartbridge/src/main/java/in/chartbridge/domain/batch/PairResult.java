package in.chartbridge.domain.batch;

import in.chartbridge.domain.model.ChartData;

/**
 * Outcome of one pair: either chart data or the error that replaced it.
 */
public record PairResult(ChartPair pair, ChartData data, PairFetchException error, long durationMs) {

    public static PairResult success(ChartPair pair, ChartData data, long durationMs) {
        return new PairResult(pair, data, null, durationMs);
    }

    public static PairResult failure(PairFetchException error, long durationMs) {
        return new PairResult(error.getPair(), null, error, durationMs);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String symbol() {
        return pair.symbol();
    }

    public String resolution() {
        return pair.resolution();
    }
}
