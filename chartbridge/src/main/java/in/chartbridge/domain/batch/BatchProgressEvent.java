package in.chartbridge.domain.batch;

import java.time.Instant;
import java.util.List;

/**
 * Emitted once per completed group, before the next group starts.
 *
 * @param batchIndex 1-based group number
 * @param symbols    distinct symbols of this group, in pair order
 * @param charts     one result per pair of the group, in pair order
 * @param progress   pairs finished so far across the whole job
 * @param errors     {@code "SYM (RES): message"} for each failed pair of the group
 */
public record BatchProgressEvent(
        int batchIndex,
        int totalBatches,
        List<String> symbols,
        List<PairResult> charts,
        Progress progress,
        Timing timing,
        List<String> errors) {

    public BatchProgressEvent {
        symbols = List.copyOf(symbols);
        charts = List.copyOf(charts);
        errors = List.copyOf(errors);
    }

    public record Progress(int loaded, int total, int percentage) {

        public static Progress of(int loaded, int total) {
            return new Progress(loaded, total, total == 0 ? 100 : Math.round(loaded * 100f / total));
        }
    }

    public record Timing(Instant startTime, Instant endTime, long durationMs) {
    }
}
