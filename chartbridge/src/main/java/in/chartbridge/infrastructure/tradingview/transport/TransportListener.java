package in.chartbridge.infrastructure.tradingview.transport;

/**
 * Callbacks from a {@link Transport}.
 */
public interface TransportListener {

    /**
     * A complete text message (one or more frames, or a fraction of one).
     */
    void onMessage(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
