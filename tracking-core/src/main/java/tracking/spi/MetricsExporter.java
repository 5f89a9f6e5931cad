package tracking.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see tracking.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of carrier events stored for the first time.
     */
    void incrementIngestAccepted();

    /**
     * Increments the count of redeliveries collapsed by the dedup key.
     */
    void incrementIngestDuplicate();

    /**
     * Increments the count of payloads that could not be attached to a shipment or parsed.
     */
    void incrementIngestRejected();

    /**
     * Increments the count of accepted events with an occurrence code missing from the registry.
     */
    void incrementUnclassified();

    /**
     * Increments the count of committed shipment status transitions.
     */
    void incrementTransition();

    /**
     * Increments the count of events whose fold disposition was ANOMALY.
     */
    void incrementAnomaly();

    /**
     * Increments the count of version conflicts hit while committing a transition.
     */
    default void incrementStorageConflict() {
    }

    /**
     * Increments the count of shipments flagged because their status could not be re-derived
     * after an event was stored.
     */
    default void incrementReconcileRequested() {
    }

    /**
     * Increments the count of flagged shipments re-derived by the reconcile sweep.
     */
    default void incrementReconcileCompleted() {
    }

    /**
     * Increments the count of invocations enqueued via the hot path.
     */
    void incrementHotEnqueued();

    /**
     * Increments the count of invocations dropped because the hot queue was full.
     * The poller picks them up later.
     */
    void incrementHotDropped();

    /**
     * Increments the count of invocations enqueued via the cold (poller) path.
     */
    void incrementColdEnqueued();

    /**
     * Increments the count of invocations whose actions all succeeded.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of invocations that failed and will be retried.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of invocations moved to DEAD.
     */
    void incrementDispatchDead();

    /**
     * Increments the count of individual action failures, including timeouts.
     */
    default void incrementActionFailure() {
    }

    /**
     * Increments the count of unresolved events attached to a shipment on replay.
     */
    default void incrementReplayResolved() {
    }

    /**
     * Increments the count of unresolved events moved to review after the retry window.
     */
    default void incrementReplayExpired() {
    }

    /**
     * Increments the count of archive records dropped (queue full or retries exhausted).
     */
    void incrementArchiveDropped();

    /**
     * Records the current depth of both dispatch queues.
     *
     * @param hotDepth  number of invocations in the hot queue
     * @param coldDepth number of invocations in the cold queue
     */
    void recordQueueDepths(int hotDepth, int coldDepth);

    /**
     * Records the lag (in milliseconds) of the oldest pending invocation.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Records the current depth of the archival queue.
     *
     * @param depth number of records waiting to be archived
     */
    default void recordArchiveQueueDepth(int depth) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementIngestAccepted() {
        }

        @Override
        public void incrementIngestDuplicate() {
        }

        @Override
        public void incrementIngestRejected() {
        }

        @Override
        public void incrementUnclassified() {
        }

        @Override
        public void incrementTransition() {
        }

        @Override
        public void incrementAnomaly() {
        }

        @Override
        public void incrementHotEnqueued() {
        }

        @Override
        public void incrementHotDropped() {
        }

        @Override
        public void incrementColdEnqueued() {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementDispatchDead() {
        }

        @Override
        public void incrementArchiveDropped() {
        }

        @Override
        public void recordQueueDepths(int hotDepth, int coldDepth) {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
