package tracking.timeline;

import tracking.model.CanonicalStatus;
import tracking.model.TrackingEvent;
import tracking.state.Disposition;

import java.time.Instant;

/**
 * One event in a shipment's ordered history, annotated with what the status fold did with it.
 *
 * @param event       the stored event
 * @param disposition fold outcome for the event
 * @param statusAfter shipment status after folding this event
 */
public record TimelineEntry(TrackingEvent event, Disposition disposition, CanonicalStatus statusAfter) {

  public Instant occurredAt() {
    return event.occurredAt();
  }

  /**
   * Whether the occurrence time is the receipt time because the payload carried none.
   */
  public boolean estimated() {
    return event.occurredAtEstimated();
  }
}
