package in.chartbridge.infrastructure.tradingview.transport;

import in.chartbridge.config.TradingViewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Transport} over {@code java.net.http.WebSocket}.
 *
 * Fragmented text messages are reassembled before reaching the listener. Sends
 * are chained so a new message is only handed to the socket after the previous
 * one completed, as the JDK WebSocket requires.
 */
public class JdkWebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final String connectionId;
    private final HttpClient httpClient;
    private final TradingViewConfig config;

    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final Object sendLock = new Object();
    private CompletableFuture<WebSocket> sendChain;
    private volatile boolean open = false;
    private volatile TransportListener listener;

    public JdkWebSocketTransport(String connectionId, HttpClient httpClient, TradingViewConfig config) {
        this.connectionId = connectionId;
        this.httpClient = httpClient;
        this.config = config;
    }

    /**
     * Factory sharing one HttpClient across all transports.
     */
    public static TransportFactory factory(HttpClient httpClient, TradingViewConfig config) {
        return connectionId -> new JdkWebSocketTransport(connectionId, httpClient, config);
    }

    @Override
    public String id() {
        return connectionId;
    }

    @Override
    public CompletableFuture<Void> open(TransportListener listener) {
        URI uri = buildUri(config);
        log.debug("[TV WS] [{}] Connecting to {}", connectionId, uri.getHost());

        this.listener = listener;
        CompletableFuture<Void> result = new CompletableFuture<>();

        httpClient.newWebSocketBuilder()
            .header("Origin", config.origin())
            .connectTimeout(config.connectTimeout())
            .buildAsync(uri, new WebSocket.Listener() {
                private final StringBuilder buf = new StringBuilder();

                @Override
                public void onOpen(WebSocket webSocket) {
                    wsRef.set(webSocket);
                    synchronized (sendLock) {
                        sendChain = CompletableFuture.completedFuture(webSocket);
                    }
                    open = true;
                    log.debug("[TV WS] [{}] Connected", connectionId);
                    webSocket.request(1);
                    result.complete(null);
                }

                @Override
                public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                    buf.append(data);
                    if (last) {
                        String msg = buf.toString();
                        buf.setLength(0);
                        try {
                            listener.onMessage(msg);
                        } catch (Exception e) {
                            log.error("[TV WS] [{}] Listener failed on message", connectionId, e);
                        }
                    }
                    webSocket.request(1);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
                    open = false;
                    wsRef.set(null);
                    log.debug("[TV WS] [{}] Closed by server: {} {}", connectionId, statusCode, reason);
                    if (!result.isDone()) {
                        result.completeExceptionally(new TransportException(connectionId,
                            "Closed during handshake: " + statusCode + " " + reason));
                    }
                    listener.onClosed(statusCode, reason);
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void onError(WebSocket webSocket, Throwable error) {
                    open = false;
                    wsRef.set(null);
                    log.warn("[TV WS] [{}] WebSocket error: {}", connectionId, error.getMessage());
                    if (!result.isDone()) {
                        result.completeExceptionally(new TransportException(connectionId,
                            "Connect failed: " + error.getMessage(), error));
                    }
                    listener.onError(error);
                }
            })
            .whenComplete((ws, error) -> {
                if (error != null && !result.isDone()) {
                    result.completeExceptionally(new TransportException(connectionId,
                        "Connect failed: " + error.getMessage(), error));
                }
            });

        return result;
    }

    @Override
    public void send(String text) {
        if (!open || wsRef.get() == null) {
            throw new TransportException(connectionId, "Send on closed transport");
        }
        synchronized (sendLock) {
            sendChain = sendChain.thenCompose(ws -> ws.sendText(text, true));
            sendChain.exceptionally(error -> {
                log.warn("[TV WS] [{}] Send failed: {}", connectionId, error.getMessage());
                if (open) {
                    open = false;
                    listener.onError(error);
                }
                return null;
            });
        }
    }

    @Override
    public void close() {
        WebSocket ws = wsRef.getAndSet(null);
        open = false;
        if (ws != null) {
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
            } catch (Exception e) {
                log.debug("[TV WS] [{}] Close handshake failed: {}", connectionId, e.getMessage());
                ws.abort();
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    static URI buildUri(TradingViewConfig config) {
        String date = Instant.now().truncatedTo(ChronoUnit.SECONDS).toString();
        String query = "from=" + URLEncoder.encode("chart/" + config.chartId() + "/", StandardCharsets.UTF_8)
            + "&date=" + URLEncoder.encode(date, StandardCharsets.UTF_8)
            + "&type=chart";
        return URI.create(config.wsUrl() + "?" + query);
    }
}
