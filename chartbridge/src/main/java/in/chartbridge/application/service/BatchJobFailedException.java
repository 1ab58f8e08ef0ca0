package in.chartbridge.application.service;

import in.chartbridge.domain.batch.BatchSummary;

/**
 * Every pair of a batch job failed. Thrown after the last progress event was delivered.
 */
public class BatchJobFailedException extends RuntimeException {

    private final BatchSummary summary;

    public BatchJobFailedException(BatchSummary summary, String message, Throwable cause) {
        super(String.format("All %d charts failed: %s", summary.totalCharts(), message), cause);
        this.summary = summary;
    }

    public BatchSummary getSummary() {
        return summary;
    }
}
