package in.chartbridge.domain.batch;

/**
 * Why one pair of a batch has no data. Recorded on the pair result and never thrown past the batch.
 */
public class PairFetchException extends RuntimeException {

    public enum Kind {
        /** invalid request or indicator settings; the transport was not contacted */
        VALIDATION,
        /** the server rejected the symbol or resolution, or returned no bars */
        REJECTED,
        TRANSPORT,
        /** the JWT was refused; the caller must refresh it */
        SESSION_EXPIRED,
        POOL_EXHAUSTED,
        UNKNOWN
    }

    private final ChartPair pair;
    private final Kind kind;

    public PairFetchException(ChartPair pair, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.pair = pair;
        this.kind = kind;
    }

    public ChartPair getPair() {
        return pair;
    }

    public Kind getKind() {
        return kind;
    }
}
