package in.chartbridge.infrastructure.tradingview.session;

/**
 * The server refused one request (unknown symbol, invalid resolution, series limit)
 * or returned no bars for it. The connection stays usable.
 */
public class RequestRejectedException extends RuntimeException {

    private final String connectionId;
    private final String symbol;
    private final String reason;

    public RequestRejectedException(String connectionId, String symbol, String reason) {
        super(String.format("[%s] %s: %s", connectionId, symbol, reason));
        this.connectionId = connectionId;
        this.symbol = symbol;
        this.reason = reason;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getReason() {
        return reason;
    }
}
