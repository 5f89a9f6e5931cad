package tracking;

import tracking.model.UnresolvedEvent;
import tracking.state.Reevaluation;
import tracking.timeline.TimelineEntry;

/**
 * Callbacks for in-process observers of the engine. Invoked on the ingesting thread after
 * the corresponding change is committed; exceptions are logged and ignored.
 */
public interface TrackingListener {

    TrackingListener NOOP = new TrackingListener() {};

    /**
     * A shipment's stored status changed.
     */
    default void onTransition(Reevaluation transition) {
    }

    /**
     * An event regressed the shipment's progress or arrived after being overtaken.
     *
     * @param shipmentId the shipment
     * @param entry      the anomalous timeline entry
     */
    default void onAnomaly(String shipmentId, TimelineEntry entry) {
    }

    /**
     * A payload could not be attached to a shipment and was parked.
     */
    default void onRejected(UnresolvedEvent parked) {
    }
}
