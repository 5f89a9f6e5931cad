package tracking.spi;

import tracking.model.ArchiveRecord;

/**
 * Write-only document store for raw events and timeline snapshots.
 *
 * <p>Called from the archival sink's worker thread; failures are retried there.
 *
 * @see tracking.archive.ArchivalSink
 */
@FunctionalInterface
public interface ArchiveStore {

    void write(ArchiveRecord record) throws Exception;
}
