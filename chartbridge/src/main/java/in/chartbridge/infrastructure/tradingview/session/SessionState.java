package in.chartbridge.infrastructure.tradingview.session;

/**
 * States of one chart session.
 *
 * <pre>
 * IDLE -> CONNECTING -> AUTHENTICATING -> CHART_SESSION_CREATED -> SYMBOL_RESOLVING
 *      -> SERIES_CREATING -> AWAITING_BARS -> READY
 * READY -> MODIFYING_SYMBOL -> AWAITING_BARS -> READY
 * any   -> CLOSED
 * </pre>
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    AUTHENTICATING,
    CHART_SESSION_CREATED,
    SYMBOL_RESOLVING,
    SERIES_CREATING,
    AWAITING_BARS,
    READY,
    MODIFYING_SYMBOL,
    CLOSED;

    /**
     * Latency phase this state measures, or null for resting states.
     */
    public String phase() {
        return switch (this) {
            case CONNECTING -> "connect";
            case AUTHENTICATING -> "auth";
            case SYMBOL_RESOLVING, MODIFYING_SYMBOL -> "resolve";
            case SERIES_CREATING -> "series";
            case AWAITING_BARS -> "wait";
            default -> null;
        };
    }

    /**
     * True for states in which a new fetch may start.
     */
    public boolean acceptsRequests() {
        return this == CHART_SESSION_CREATED || this == READY;
    }
}
