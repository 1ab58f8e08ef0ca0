package in.chartbridge.infrastructure.tradingview.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Codec for the length-prefixed TradingView frame format.
 *
 * Wire format: {@code ~m~<decimal byte length>~m~<payload>}, repeated. The
 * declared length is the UTF-8 byte length of the payload, so all scanning
 * happens on bytes rather than chars.
 *
 * Usage:
 * <pre>
 * byte[] bytes = WireCodec.encode("{\"m\":\"set_locale\",\"p\":[\"en\",\"US\"]}");
 *
 * DecodeResult result = WireCodec.decode(chunk);
 * for (Frame frame : result.frames()) { ... }
 * // result.remainder() must be prepended to the next chunk
 * </pre>
 *
 * {@link FrameDecoder} does the remainder bookkeeping for a single stream.
 */
public final class WireCodec {

    static final byte[] DELIMITER = "~m~".getBytes(StandardCharsets.US_ASCII);

    /** Longest decimal length accepted; anything longer is treated as corruption. */
    static final int MAX_LENGTH_DIGITS = 9;

    private static final Pattern HEARTBEAT = Pattern.compile("~h~\\d+");

    /**
     * Encode a payload into one frame.
     */
    public static byte[] encode(String payload) {
        return encodeText(payload).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encode a payload into one frame as text, for transports that send text messages.
     */
    public static String encodeText(String payload) {
        int length = payload.getBytes(StandardCharsets.UTF_8).length;
        return "~m~" + length + "~m~" + payload;
    }

    /**
     * Heartbeat reply for a ping frame: the same payload, re-framed unmodified.
     */
    public static String heartbeatReply(Frame ping) {
        if (!ping.isPing()) {
            throw new IllegalArgumentException("Not a heartbeat frame: " + ping.payload());
        }
        return encodeText(ping.payload());
    }

    public static boolean isHeartbeat(String payload) {
        return HEARTBEAT.matcher(payload).matches();
    }

    /**
     * Decode as many complete frames as the buffer holds.
     *
     * Truncated input (in the delimiter, the length digits or the payload) is
     * never an error: the incomplete tail is returned as the remainder.
     *
     * @throws ProtocolException if a declared length is non-numeric or too long,
     *                           or a delimiter is corrupt
     */
    public static DecodeResult decode(byte[] buffer) {
        List<Frame> frames = new ArrayList<>();
        int pos = 0;
        int len = buffer.length;

        while (pos < len) {
            // Leading delimiter
            if (!matchesDelimiter(buffer, pos)) {
                throw new ProtocolException("Expected frame delimiter", pos);
            }
            if (len - pos < DELIMITER.length) {
                break;
            }

            // Length digits
            int digitsStart = pos + DELIMITER.length;
            int cursor = digitsStart;
            while (cursor < len && isDigit(buffer[cursor])) {
                cursor++;
            }
            int digitCount = cursor - digitsStart;
            if (digitCount > MAX_LENGTH_DIGITS) {
                throw new ProtocolException("Declared frame length too long", digitsStart);
            }
            if (cursor == len) {
                break;
            }
            if (digitCount == 0) {
                throw new ProtocolException("Non-numeric frame length", digitsStart);
            }

            // Closing delimiter
            if (!matchesDelimiter(buffer, cursor)) {
                throw new ProtocolException("Non-numeric frame length", cursor);
            }
            if (len - cursor < DELIMITER.length) {
                break;
            }

            int declared = Integer.parseInt(new String(buffer, digitsStart, digitCount, StandardCharsets.US_ASCII));
            int payloadStart = cursor + DELIMITER.length;
            if ((long) payloadStart + declared > len) {
                break;
            }

            String payload = new String(buffer, payloadStart, declared, StandardCharsets.UTF_8);
            frames.add(new Frame(isHeartbeat(payload) ? Frame.Kind.PING : Frame.Kind.MESSAGE, payload));
            pos = payloadStart + declared;
        }

        return new DecodeResult(frames, Arrays.copyOfRange(buffer, pos, len));
    }

    /**
     * True when the bytes at {@code offset} are the delimiter, or a prefix of it
     * that runs into the end of the buffer.
     */
    private static boolean matchesDelimiter(byte[] buffer, int offset) {
        int available = Math.min(DELIMITER.length, buffer.length - offset);
        for (int i = 0; i < available; i++) {
            if (buffer[offset + i] != DELIMITER[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }

    private WireCodec() {}
}
