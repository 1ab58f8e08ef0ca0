package in.chartbridge.infrastructure.tradingview.codec;

import java.util.List;

/**
 * Result of decoding a chunk of bytes.
 *
 * @param frames    complete frames in arrival order
 * @param remainder trailing bytes that do not yet form a complete frame
 */
public record DecodeResult(List<Frame> frames, byte[] remainder) {

    public boolean hasRemainder() {
        return remainder.length > 0;
    }
}
