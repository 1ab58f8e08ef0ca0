package in.chartbridge.infrastructure.tradingview.session;

import java.time.Duration;

/**
 * One state change of a chart session.
 *
 * @param elapsed time spent in {@code from}
 */
public record SessionTransition(
        String connectionId,
        SessionState from,
        SessionState to,
        Duration elapsed) {
}
