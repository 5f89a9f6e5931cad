package tracking;

import tracking.model.CanonicalStatus;
import tracking.model.Shipment;

import java.time.Instant;

/**
 * Read-only view of a shipment's stored status.
 */
public record ShipmentStatusView(
    String shipmentId,
    String trackingCode,
    CanonicalStatus status,
    long statusVersion,
    String lastEventId,
    Instant updatedAt
) {

  static ShipmentStatusView of(Shipment shipment) {
    return new ShipmentStatusView(shipment.id(), shipment.trackingCode(), shipment.currentStatus(),
        shipment.currentStatusVersion(), shipment.lastEventId(), shipment.updatedAt());
  }
}
