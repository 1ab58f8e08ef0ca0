package in.chartbridge.application.service;

import in.chartbridge.domain.batch.BatchProgressEvent;

/**
 * Receives each completed group. Called on the fetching thread; the next group starts
 * only after this returns.
 */
@FunctionalInterface
public interface BatchProgressListener {

    BatchProgressListener NOOP = event -> { };

    void onBatchComplete(BatchProgressEvent event);
}
