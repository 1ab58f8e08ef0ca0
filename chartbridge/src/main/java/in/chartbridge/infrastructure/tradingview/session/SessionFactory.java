package in.chartbridge.infrastructure.tradingview.session;

/**
 * Creates unconnected chart sessions, one per pooled connection.
 */
@FunctionalInterface
public interface SessionFactory {

    ChartSession create(String connectionId);
}
