package in.chartbridge.infrastructure.tradingview.transport;

/**
 * Socket-level failure or a timeout waiting on the server.
 *
 * Fatal to the connection that raised it; the pool discards that connection
 * and leaves other leases untouched.
 */
public class TransportException extends RuntimeException {

    private final String connectionId;

    public TransportException(String connectionId, String message) {
        super(String.format("[%s] %s", connectionId, message));
        this.connectionId = connectionId;
    }

    public TransportException(String connectionId, String message, Throwable cause) {
        super(String.format("[%s] %s", connectionId, message), cause);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
