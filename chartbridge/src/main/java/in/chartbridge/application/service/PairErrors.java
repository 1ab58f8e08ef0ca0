package in.chartbridge.application.service;

import in.chartbridge.domain.batch.ChartPair;
import in.chartbridge.domain.batch.PairFetchException;
import in.chartbridge.domain.batch.PairFetchException.Kind;
import in.chartbridge.infrastructure.tradingview.pool.PoolExhaustedException;
import in.chartbridge.infrastructure.tradingview.session.RequestRejectedException;
import in.chartbridge.infrastructure.tradingview.session.SessionExpiredException;
import in.chartbridge.infrastructure.tradingview.transport.TransportException;
import in.chartbridge.service.validation.ConstraintViolationException;

/**
 * Maps fetch failures onto the pair error kinds.
 */
final class PairErrors {

    private PairErrors() {
    }

    static PairFetchException classify(ChartPair pair, RuntimeException error) {
        if (error instanceof PairFetchException) {
            return (PairFetchException) error;
        }
        return new PairFetchException(pair, kindOf(error), messageOf(error), error);
    }

    static Kind kindOf(RuntimeException error) {
        if (error instanceof ConstraintViolationException) {
            return Kind.VALIDATION;
        }
        if (error instanceof RequestRejectedException) {
            return Kind.REJECTED;
        }
        if (error instanceof SessionExpiredException) {
            return Kind.SESSION_EXPIRED;
        }
        if (error instanceof TransportException) {
            return Kind.TRANSPORT;
        }
        if (error instanceof PoolExhaustedException) {
            return Kind.POOL_EXHAUSTED;
        }
        return Kind.UNKNOWN;
    }

    private static String messageOf(RuntimeException error) {
        if (error instanceof RequestRejectedException) {
            return ((RequestRejectedException) error).getReason();
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
