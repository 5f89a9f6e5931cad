package tracking.timeline;

import tracking.model.CanonicalStatus;
import tracking.state.Disposition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered history of one shipment and the status derived from it.
 *
 * @param shipmentId   the shipment
 * @param entries      entries in timeline order
 * @param status       status after folding every entry
 * @param gapThreshold default threshold for {@link #gaps()}
 */
public record Timeline(String shipmentId, List<TimelineEntry> entries, CanonicalStatus status,
    Duration gapThreshold) {

  public Timeline {
    Objects.requireNonNull(shipmentId, "shipmentId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(gapThreshold, "gapThreshold");
    entries = List.copyOf(entries);
  }

  public static Timeline empty(String shipmentId, Duration gapThreshold) {
    return new Timeline(shipmentId, List.of(), CanonicalStatus.CREATED, gapThreshold);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public Optional<TimelineEntry> entry(String eventId) {
    for (TimelineEntry entry : entries) {
      if (entry.event().id().equals(eventId)) {
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  public List<TimelineEntry> withDisposition(Disposition disposition) {
    return entries.stream().filter(e -> e.disposition() == disposition).toList();
  }

  public List<TimelineEntry> anomalies() {
    return withDisposition(Disposition.ANOMALY);
  }

  /**
   * Returns the gaps longer than the default threshold.
   */
  public List<TimelineGap> gaps() {
    return gaps(gapThreshold);
  }

  /**
   * Returns consecutive entry pairs whose occurrence times are more than {@code threshold} apart.
   *
   * @param threshold the minimum silence worth reporting
   * @return gaps in timeline order
   */
  public List<TimelineGap> gaps(Duration threshold) {
    Objects.requireNonNull(threshold, "threshold");
    List<TimelineGap> gaps = new ArrayList<>();
    for (int i = 1; i < entries.size(); i++) {
      TimelineEntry previous = entries.get(i - 1);
      TimelineEntry next = entries.get(i);
      Duration between = Duration.between(previous.occurredAt(), next.occurredAt());
      if (between.compareTo(threshold) > 0) {
        gaps.add(new TimelineGap(previous, next, between));
      }
    }
    return List.copyOf(gaps);
  }
}
