package in.chartbridge.infrastructure.tradingview.codec;

/**
 * Thrown when the wire stream is corrupt beyond recovery: a non-numeric or
 * oversized declared length, or a missing delimiter where one is required.
 *
 * Fatal to the connection that produced the bytes, never to the pool.
 */
public class ProtocolException extends RuntimeException {

    private final int offset;

    public ProtocolException(String message, int offset) {
        super(String.format("%s (offset %d)", message, offset));
        this.offset = offset;
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.offset = -1;
    }

    /**
     * @return byte offset in the decoded buffer where corruption was detected, or -1
     */
    public int getOffset() {
        return offset;
    }
}
