package tracking;

/**
 * Thrown when a status transition could not be committed because the shipment's status
 * version kept changing underneath it, after the configured number of retries.
 *
 * <p>The events are already stored; the status can be re-derived with
 * {@link TrackingEngine#reconcile(String)}.
 */
public class StorageConflictException extends RuntimeException {

    private final String shipmentId;
    private final int attempts;

    public StorageConflictException(String shipmentId, int attempts) {
        super("Status version conflict for shipment " + shipmentId + " after " + attempts + " attempts");
        this.shipmentId = shipmentId;
        this.attempts = attempts;
    }

    public String shipmentId() {
        return shipmentId;
    }

    public int attempts() {
        return attempts;
    }
}
