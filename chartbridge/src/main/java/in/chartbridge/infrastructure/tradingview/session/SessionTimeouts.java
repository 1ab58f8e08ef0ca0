package in.chartbridge.infrastructure.tradingview.session;

import in.chartbridge.config.TradingViewConfig;

import java.time.Duration;

/**
 * Bounds on every wait a chart session performs.
 *
 * @param connect     transport open
 * @param resolve     resolve_symbol until symbol_resolved
 * @param series      create/modify series until the first bar frame
 * @param study       indicator data while the server reports the study as loading
 * @param idleBarWait silence after the last bar frame before the series counts as settled
 */
public record SessionTimeouts(
        Duration connect,
        Duration resolve,
        Duration series,
        Duration study,
        Duration idleBarWait) {

    public static SessionTimeouts from(TradingViewConfig config) {
        return new SessionTimeouts(
            config.connectTimeout(),
            config.resolveTimeout(),
            config.seriesTimeout(),
            config.studyTimeout(),
            config.idleBarWait());
    }
}
