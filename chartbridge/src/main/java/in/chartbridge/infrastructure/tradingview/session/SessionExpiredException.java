package in.chartbridge.infrastructure.tradingview.session;

/**
 * The server rejected the bearer token, or never answered after it was sent.
 *
 * Not a transport failure: the caller has to obtain a fresh token and retry the
 * whole acquisition instead of retrying with the same one.
 */
public class SessionExpiredException extends RuntimeException {

    private final String connectionId;

    public SessionExpiredException(String connectionId, String message) {
        super(String.format("[%s] %s", connectionId, message));
        this.connectionId = connectionId;
    }

    public SessionExpiredException(String connectionId, String message, Throwable cause) {
        super(String.format("[%s] %s", connectionId, message), cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
