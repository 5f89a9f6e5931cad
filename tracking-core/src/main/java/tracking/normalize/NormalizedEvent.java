package tracking.normalize;

import tracking.model.Shipment;
import tracking.model.TrackingEvent;

import java.util.Objects;

/**
 * Outcome of normalizing one raw carrier payload.
 */
public sealed interface NormalizedEvent permits NormalizedEvent.Canonical, NormalizedEvent.Rejected {

  /**
   * The payload maps to a canonical event of a known shipment.
   *
   * @param event    the normalized, not yet persisted, event
   * @param shipment the resolved shipment as read during normalization
   */
  record Canonical(TrackingEvent event, Shipment shipment) implements NormalizedEvent {
    public Canonical {
      Objects.requireNonNull(event, "event");
      Objects.requireNonNull(shipment, "shipment");
    }
  }

  /**
   * The payload could not be normalized.
   *
   * @param reason       why
   * @param detail       human readable detail
   * @param shipmentHint the shipment reference that was tried, may be {@code null}
   */
  record Rejected(RejectionReason reason, String detail, String shipmentHint) implements NormalizedEvent {
    public Rejected {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
