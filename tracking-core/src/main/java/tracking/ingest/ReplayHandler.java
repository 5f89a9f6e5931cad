package tracking.ingest;

import tracking.model.UnresolvedEvent;

/**
 * Re-runs normalization and ingestion for a parked payload.
 */
@FunctionalInterface
public interface ReplayHandler {

    /**
     * @param entry the parked payload, with its original receipt time
     * @return what happened to it this time
     */
    Outcome replay(UnresolvedEvent entry);

    enum Outcome {
        /** The shipment now exists and the event was stored (or was already stored). */
        RESOLVED,
        /** Still no matching shipment. */
        UNRESOLVED,
        /** The payload cannot be normalized at all; it needs a human. */
        REJECTED
    }
}
