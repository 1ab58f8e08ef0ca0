package in.chartbridge.infrastructure.tradingview.transport;

/**
 * Creates unopened transports, one per pooled connection.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport create(String connectionId);
}
