package in.chartbridge.infrastructure.tradingview.pool;

import in.chartbridge.infrastructure.tradingview.session.ChartSession;

/**
 * One authenticated transport plus its chart session, owned by the pool.
 *
 * Mutable fields are only touched under the pool lock.
 */
final class PooledConnection {

    private final ChartSession session;
    private final String jwt;
    private int requestCount;

    PooledConnection(ChartSession session, String jwt) {
        this.session = session;
        this.jwt = jwt;
    }

    ChartSession session() {
        return session;
    }

    String id() {
        return session.connectionId();
    }

    boolean servesToken(String token) {
        return jwt.equals(token);
    }

    int requestCount() {
        return requestCount;
    }

    int incrementRequestCount() {
        return ++requestCount;
    }
}
