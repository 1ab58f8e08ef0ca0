package in.chartbridge.domain.batch;

/**
 * One (symbol, resolution) unit of batch work.
 */
public record ChartPair(String symbol, String resolution) {

    @Override
    public String toString() {
        return symbol + " (" + resolution + ")";
    }
}
