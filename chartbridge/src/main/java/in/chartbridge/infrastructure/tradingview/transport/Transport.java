package in.chartbridge.infrastructure.tradingview.transport;

import java.util.concurrent.CompletableFuture;

/**
 * A persistent text-message socket carrying framed protocol traffic.
 *
 * Lifecycle:
 * 1. {@link #open(TransportListener)} once; the future completes when the socket is usable
 * 2. {@link #send(String)} any number of times; messages go out in call order
 * 3. {@link #close()} exactly once; idempotent
 *
 * Listener callbacks arrive in receive order on a transport-owned thread.
 */
public interface Transport {

    /**
     * @return id used in log lines and exception prefixes
     */
    String id();

    CompletableFuture<Void> open(TransportListener listener);

    /**
     * Send one already-framed text message.
     *
     * @throws TransportException if the transport is not open
     */
    void send(String text);

    void close();

    boolean isOpen();
}
