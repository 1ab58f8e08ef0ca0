package in.chartbridge.infrastructure.tradingview.codec;

/**
 * One decoded wire frame.
 *
 * @param kind    MESSAGE for JSON command/event payloads, PING for heartbeats
 * @param payload the payload text exactly as it appeared between delimiters
 */
public record Frame(Kind kind, String payload) {

    public enum Kind {
        /** JSON command or event object (or any non-heartbeat text). */
        MESSAGE,
        /** Numeric heartbeat ({@code ~h~<n>}) that must be echoed back verbatim. */
        PING
    }

    public boolean isPing() {
        return kind == Kind.PING;
    }
}
