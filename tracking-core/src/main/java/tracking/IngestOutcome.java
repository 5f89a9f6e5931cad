package tracking;

import tracking.model.CanonicalStatus;
import tracking.state.Disposition;

/**
 * What happened to one raw carrier payload.
 *
 * @param kind           accepted, duplicate or rejected
 * @param eventId        stored event id; {@code null} unless accepted
 * @param shipmentId     resolved shipment; {@code null} when rejected
 * @param reason         rejection reason name; {@code null} unless rejected
 * @param previousStatus status before this payload; {@code null} unless accepted
 * @param newStatus      status after this payload; {@code null} unless accepted
 * @param transitioned   whether the payload caused a committed status transition
 * @param disposition    what the status fold did with the event; {@code null} unless accepted
 */
public record IngestOutcome(
    Kind kind,
    String eventId,
    String shipmentId,
    String reason,
    CanonicalStatus previousStatus,
    CanonicalStatus newStatus,
    boolean transitioned,
    Disposition disposition
) {

  public enum Kind {
    ACCEPTED,
    DUPLICATE,
    REJECTED
  }

  static IngestOutcome accepted(String eventId, String shipmentId, CanonicalStatus previousStatus,
      CanonicalStatus newStatus, boolean transitioned, Disposition disposition) {
    return new IngestOutcome(Kind.ACCEPTED, eventId, shipmentId, null, previousStatus, newStatus,
        transitioned, disposition);
  }

  static IngestOutcome duplicate(String shipmentId) {
    return new IngestOutcome(Kind.DUPLICATE, null, shipmentId, null, null, null, false, null);
  }

  static IngestOutcome rejected(String reason) {
    return new IngestOutcome(Kind.REJECTED, null, null, reason, null, null, false, null);
  }

  public boolean accepted() {
    return kind == Kind.ACCEPTED;
  }
}
