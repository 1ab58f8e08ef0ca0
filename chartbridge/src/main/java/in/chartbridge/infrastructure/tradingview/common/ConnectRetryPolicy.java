package in.chartbridge.infrastructure.tradingview.common;

import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;

import java.time.Duration;

/**
 * Backoff for opening a fresh chart connection.
 *
 * Immutable: the caller counts its own failures. The delay doubles per failure up to
 * {@code maxDelay}. A refused token is never retried, a new socket would be refused too.
 *
 * Usage:
 * <pre>
 * ConnectRetryPolicy policy = ConnectRetryPolicy.forPool(Duration.ofSeconds(1), 3);
 * for (int failures = 1; ; failures++) {
 *     try {
 *         return connect();
 *     } catch (RuntimeException e) {
 *         if (!policy.shouldRetry(failures, e)) throw e;
 *         Thread.sleep(policy.delayAfter(failures).toMillis());
 *     }
 * }
 * </pre>
 */
public final class ConnectRetryPolicy {

    public static final Duration DEFAULT_FIRST_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

    private final Duration firstDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ConnectRetryPolicy(Duration firstDelay, Duration maxDelay, int maxAttempts) {
        if (firstDelay.isNegative()) {
            throw new IllegalArgumentException("First delay must not be negative");
        }
        if (maxDelay.compareTo(firstDelay) < 0) {
            throw new IllegalArgumentException("Max delay must be >= first delay");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        this.firstDelay = firstDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * 1s first delay, capped at 10s.
     */
    public static ConnectRetryPolicy defaults(int maxAttempts) {
        return new ConnectRetryPolicy(DEFAULT_FIRST_DELAY, DEFAULT_MAX_DELAY, maxAttempts);
    }

    /**
     * Policy for a connection pool: delays capped at eight times the first one.
     */
    public static ConnectRetryPolicy forPool(Duration firstDelay, int maxAttempts) {
        return new ConnectRetryPolicy(firstDelay, firstDelay.multipliedBy(8), maxAttempts);
    }

    /**
     * @param failures attempts that failed so far, counting the one that just failed
     * @param error    the failure of the last attempt
     */
    public boolean shouldRetry(int failures, RuntimeException error) {
        return failures < maxAttempts && !(error instanceof SessionExpiredException);
    }

    /**
     * @param failures attempts that failed so far, at least 1
     * @return how long to wait before the next attempt
     */
    public Duration delayAfter(int failures) {
        long cap = maxDelay.toMillis();
        long millis = firstDelay.toMillis();
        for (int i = 1; i < failures && millis < cap; i++) {
            millis *= 2;
        }
        return Duration.ofMillis(Math.min(millis, cap));
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
