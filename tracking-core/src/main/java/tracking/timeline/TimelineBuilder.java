package tracking.timeline;

import tracking.model.TrackingEvent;
import tracking.state.StatusStateMachine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orders a shipment's events and folds them through the {@link StatusStateMachine}.
 *
 * <p>Order: {@code occurredAt}, then {@code receivedAt}, then the configured tie-breaker
 * (by default the event id, a time-ordered ULID). The result depends only on the event set,
 * so rebuilding a timeline always yields the same entries and status.
 *
 * <p>Create instances via {@link #builder()}. Instances are immutable and thread-safe.
 */
public final class TimelineBuilder {
  public static final Comparator<TrackingEvent> BY_EVENT_ID = Comparator.comparing(TrackingEvent::id);
  public static final Comparator<TrackingEvent> BY_DEDUP_KEY = Comparator.comparing(TrackingEvent::dedupKey);
  public static final Duration DEFAULT_GAP_THRESHOLD = Duration.ofHours(72);

  private final Comparator<TrackingEvent> order;
  private final Duration gapThreshold;
  private final StatusStateMachine stateMachine;

  private TimelineBuilder(Builder builder) {
    Comparator<TrackingEvent> tieBreaker = builder.tieBreaker != null ? builder.tieBreaker : BY_EVENT_ID;
    this.order = Comparator.comparing(TrackingEvent::occurredAt)
        .thenComparing(TrackingEvent::receivedAt)
        .thenComparing(tieBreaker);
    this.gapThreshold = builder.gapThreshold != null ? builder.gapThreshold : DEFAULT_GAP_THRESHOLD;
    if (gapThreshold.isNegative() || gapThreshold.isZero()) {
      throw new IllegalArgumentException("gapThreshold must be > 0");
    }
    this.stateMachine = new StatusStateMachine();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static TimelineBuilder defaults() {
    return builder().build();
  }

  /**
   * Builds the timeline of a shipment.
   *
   * @param shipmentId the shipment
   * @param events     all of its events, in any order
   * @return the ordered, folded timeline
   */
  public Timeline build(String shipmentId, Collection<TrackingEvent> events) {
    Objects.requireNonNull(shipmentId, "shipmentId");
    List<TrackingEvent> ordered = new ArrayList<>(events);
    ordered.sort(order);

    List<TimelineEntry> entries = new ArrayList<>(ordered.size());
    StatusStateMachine.State state = StatusStateMachine.State.INITIAL;
    for (TrackingEvent event : ordered) {
      if (!event.shipmentId().equals(shipmentId)) {
        throw new IllegalArgumentException("Event " + event.id() + " belongs to shipment "
            + event.shipmentId() + ", not " + shipmentId);
      }
      boolean late = StatusStateMachine.isLateSuperseded(event, ordered);
      StatusStateMachine.Step step = stateMachine.apply(state, event.canonicalStatus(), late);
      state = step.next();
      entries.add(new TimelineEntry(event, step.disposition(), state.current()));
    }
    return new Timeline(shipmentId, entries, state.current(), gapThreshold);
  }

  public Duration gapThreshold() {
    return gapThreshold;
  }

  /** Builder for {@link TimelineBuilder}. */
  public static final class Builder {
    private Comparator<TrackingEvent> tieBreaker;
    private Duration gapThreshold;

    private Builder() {}

    /**
     * Sets the final ordering criterion for events with equal occurrence and receipt times.
     *
     * <p>Optional. Defaults to {@link #BY_EVENT_ID}.
     *
     * @param tieBreaker total order over events
     * @return this builder
     */
    public Builder tieBreaker(Comparator<TrackingEvent> tieBreaker) {
      this.tieBreaker = tieBreaker;
      return this;
    }

    /**
     * Sets the default threshold for {@link Timeline#gaps()}.
     *
     * <p>Optional. Defaults to 72 hours.
     *
     * @param gapThreshold the threshold
     * @return this builder
     */
    public Builder gapThreshold(Duration gapThreshold) {
      this.gapThreshold = gapThreshold;
      return this;
    }

    public TimelineBuilder build() {
      return new TimelineBuilder(this);
    }
  }
}
