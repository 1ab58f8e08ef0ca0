package in.chartbridge.infrastructure.tradingview.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.chartbridge.infrastructure.tradingview.codec.Frame;
import in.chartbridge.infrastructure.tradingview.codec.FrameDecoder;
import in.chartbridge.infrastructure.tradingview.codec.WireCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory transport for driving a chart session from a test.
 *
 * Outbound frames are decoded and recorded; {@link #deliver(String)} frames a payload
 * and hands it to the listener on the calling thread.
 */
public class FakeTransport implements Transport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final FrameDecoder decoder = new FrameDecoder();
    private final List<String> sent = new ArrayList<>();
    private final List<String> raw = new ArrayList<>();
    private CompletableFuture<Void> openResult = CompletableFuture.completedFuture(null);
    private volatile TransportListener listener;
    private volatile boolean open;
    private volatile boolean closed;

    public FakeTransport(String id) {
        this.id = id;
    }

    /**
     * Make {@link #open(TransportListener)} return this future instead of completing at once.
     */
    public FakeTransport openWith(CompletableFuture<Void> result) {
        this.openResult = result;
        return this;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public CompletableFuture<Void> open(TransportListener listener) {
        this.listener = listener;
        return openResult.thenRun(() -> open = true);
    }

    @Override
    public synchronized void send(String text) {
        if (!open) {
            throw new TransportException(id, "Not open");
        }
        raw.add(text);
        for (Frame frame : decoder.feed(text)) {
            sent.add(frame.payload());
        }
    }

    @Override
    public void close() {
        open = false;
        closed = true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public boolean isClosed() {
        return closed;
    }

    // ═══════════════════════════════════════════════════════════════
    // Server side
    // ═══════════════════════════════════════════════════════════════

    public void deliver(String payload) {
        deliverRaw(WireCodec.encodeText(payload));
    }

    public void deliverRaw(String text) {
        listener.onMessage(text);
    }

    public void serverClose(int code, String reason) {
        open = false;
        listener.onClosed(code, reason);
    }

    public void fail(Throwable error) {
        open = false;
        listener.onError(error);
    }

    // ═══════════════════════════════════════════════════════════════
    // Inspection
    // ═══════════════════════════════════════════════════════════════

    public synchronized List<String> sentPayloads() {
        return new ArrayList<>(sent);
    }

    /**
     * Text of every {@link #send(String)} call, exactly as written to the wire.
     */
    public synchronized List<String> sentRaw() {
        return new ArrayList<>(raw);
    }

    /**
     * Methods of every JSON command sent, in order. Heartbeat echoes are skipped.
     */
    public synchronized List<String> sentMethods() {
        List<String> methods = new ArrayList<>();
        for (String payload : sent) {
            if (!WireCodec.isHeartbeat(payload)) {
                methods.add(parse(payload).path("m").asText());
            }
        }
        return methods;
    }

    /**
     * Params of the last command with this method.
     *
     * @throws AssertionError if no such command was sent
     */
    public synchronized JsonNode lastParams(String method) {
        for (int i = sent.size() - 1; i >= 0; i--) {
            String payload = sent.get(i);
            if (WireCodec.isHeartbeat(payload)) {
                continue;
            }
            JsonNode node = parse(payload);
            if (method.equals(node.path("m").asText())) {
                return node.path("p");
            }
        }
        throw new AssertionError("No " + method + " sent; sent: " + sentMethods());
    }

    private static JsonNode parse(String payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (Exception e) {
            throw new AssertionError("Unparseable payload: " + payload, e);
        }
    }
}
