package tracking.state;

import tracking.model.AutomationInvocation;
import tracking.model.CanonicalStatus;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineEntry;

import java.util.List;

/**
 * Outcome of re-deriving a shipment's status.
 *
 * @param shipmentId     the shipment
 * @param previousStatus stored status before the call
 * @param newStatus      derived status, now stored
 * @param statusVersion  stored version after the call
 * @param changed        whether a transition was committed
 * @param claims         invocations claimed with the transition, empty if none
 * @param timeline       the timeline the status was derived from
 * @param triggerEntry   timeline entry of the triggering event, {@code null} if none
 */
public record Reevaluation(
    String shipmentId,
    CanonicalStatus previousStatus,
    CanonicalStatus newStatus,
    long statusVersion,
    boolean changed,
    List<AutomationInvocation> claims,
    Timeline timeline,
    TimelineEntry triggerEntry
) {

  public Reevaluation {
    claims = List.copyOf(claims);
  }

  public Disposition triggerDisposition() {
    return triggerEntry == null ? null : triggerEntry.disposition();
  }
}
