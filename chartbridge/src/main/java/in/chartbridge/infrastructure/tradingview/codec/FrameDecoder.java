package in.chartbridge.infrastructure.tradingview.codec;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Stateful decoder for one transport stream.
 *
 * Keeps the undecoded remainder between chunks. Not thread-safe; callers feed
 * chunks in arrival order from a single thread or under their own lock.
 */
public class FrameDecoder {

    private byte[] pending = new byte[0];

    public List<Frame> feed(String chunk) {
        return feed(chunk.getBytes(StandardCharsets.UTF_8));
    }

    public List<Frame> feed(byte[] chunk) {
        byte[] buffer;
        if (pending.length == 0) {
            buffer = chunk;
        } else {
            buffer = new byte[pending.length + chunk.length];
            System.arraycopy(pending, 0, buffer, 0, pending.length);
            System.arraycopy(chunk, 0, buffer, pending.length, chunk.length);
        }
        DecodeResult result = WireCodec.decode(buffer);
        pending = result.remainder();
        return result.frames();
    }

    public int pendingBytes() {
        return pending.length;
    }

    public void reset() {
        pending = new byte[0];
    }
}
