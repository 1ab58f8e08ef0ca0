package in.chartbridge.infrastructure.tradingview.session;

import java.util.List;

/**
 * Receives every state transition of every chart session, for latency breakdowns.
 *
 * Called while the session holds its lock: implementations must be fast and must not
 * call back into the session.
 */
@FunctionalInterface
public interface SessionObserver {

    SessionObserver NOOP = transition -> {};

    void onTransition(SessionTransition transition);

    static SessionObserver composite(SessionObserver... observers) {
        List<SessionObserver> all = List.of(observers);
        return transition -> {
            for (SessionObserver observer : all) {
                observer.onTransition(transition);
            }
        };
    }
}
