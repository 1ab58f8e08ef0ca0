package in.chartbridge.infrastructure.tradingview.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs transitions at DEBUG with the time spent in the previous state.
 */
public class LoggingSessionObserver implements SessionObserver {
    private static final Logger log = LoggerFactory.getLogger(LoggingSessionObserver.class);

    @Override
    public void onTransition(SessionTransition transition) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("[CHART SESSION] [{}] {} -> {} ({} ms)",
            transition.connectionId(), transition.from(), transition.to(), transition.elapsed().toMillis());
    }
}
