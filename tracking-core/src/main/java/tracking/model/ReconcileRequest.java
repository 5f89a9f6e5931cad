package tracking.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A shipment whose stored status may lag behind its stored events.
 *
 * @param shipmentId  the shipment
 * @param requestedAt when the most recent re-derivation failed
 */
public record ReconcileRequest(String shipmentId, Instant requestedAt) {

  public ReconcileRequest {
    Objects.requireNonNull(shipmentId, "shipmentId");
    Objects.requireNonNull(requestedAt, "requestedAt");
  }
}
