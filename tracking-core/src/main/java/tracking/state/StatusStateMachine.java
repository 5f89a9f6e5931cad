package tracking.state;

import tracking.model.CanonicalStatus;
import tracking.model.TrackingEvent;

import java.util.List;
import java.util.Objects;

/**
 * Transition function of the shipment status fold. Pure and stateless.
 *
 * <p>The fold state is the current status plus the highest progress rank reached so far.
 * Per event, first rule that matches wins:
 * <ol>
 *   <li>unclassified events change nothing;</li>
 *   <li>a progress event that was overtaken (a chronologically later, higher ranked event
 *       was received before it) is an anomaly;</li>
 *   <li>once terminal, only a higher ranked terminal event applies ({@code RETURNED} after
 *       {@code DELIVERED}); everything else is ignored;</li>
 *   <li>an exception applies from any open state;</li>
 *   <li>a progress event applies when it ranks above the progress reached, or equals it
 *       while recovering from an exception; a lower rank is an anomaly.</li>
 * </ol>
 */
public final class StatusStateMachine {

  /**
   * Fold state.
   *
   * @param current  status after the events folded so far
   * @param progress highest progress rank reached; exceptions do not lower it
   */
  public record State(CanonicalStatus current, int progress) {
    public static final State INITIAL = new State(CanonicalStatus.CREATED, CanonicalStatus.CREATED.rank());

    public State {
      Objects.requireNonNull(current, "current");
    }
  }

  /**
   * One fold step.
   *
   * @param disposition what happened to the event
   * @param next        state after the event
   */
  public record Step(Disposition disposition, State next) {}

  /**
   * Applies one event to the fold state.
   *
   * @param state          current fold state
   * @param eventStatus    the event's canonical status
   * @param lateSuperseded whether the event was overtaken, see {@link #isLateSuperseded}
   * @return the step
   */
  public Step apply(State state, CanonicalStatus eventStatus, boolean lateSuperseded) {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(eventStatus, "eventStatus");

    if (eventStatus == CanonicalStatus.UNCLASSIFIED) {
      return new Step(Disposition.UNCLASSIFIED, state);
    }
    if (lateSuperseded && eventStatus.isRanked() && !eventStatus.isTerminal()) {
      return new Step(Disposition.ANOMALY, state);
    }
    if (state.current().isTerminal()) {
      if (eventStatus.isTerminal() && eventStatus.rank() > state.current().rank()) {
        return new Step(Disposition.APPLIED, new State(eventStatus, eventStatus.rank()));
      }
      return new Step(Disposition.TERMINAL_IGNORED, state);
    }
    if (eventStatus == CanonicalStatus.EXCEPTION) {
      if (state.current() == CanonicalStatus.EXCEPTION) {
        return new Step(Disposition.NO_CHANGE, state);
      }
      return new Step(Disposition.APPLIED, new State(CanonicalStatus.EXCEPTION, state.progress()));
    }
    int rank = eventStatus.rank();
    if (rank > state.progress()) {
      return new Step(Disposition.APPLIED, new State(eventStatus, rank));
    }
    if (rank == state.progress()) {
      if (state.current() == CanonicalStatus.EXCEPTION) {
        return new Step(Disposition.APPLIED, new State(eventStatus, rank));
      }
      return new Step(Disposition.NO_CHANGE, state);
    }
    return new Step(Disposition.ANOMALY, state);
  }

  /**
   * Returns whether {@code event} was overtaken: some other event happened later, was
   * received earlier, and ranks higher.
   *
   * @param event  the candidate
   * @param events all events of the shipment
   * @return {@code true} if the event is late and superseded
   */
  public static boolean isLateSuperseded(TrackingEvent event, List<TrackingEvent> events) {
    CanonicalStatus status = event.canonicalStatus();
    if (!status.isRanked() || status.isTerminal()) {
      return false;
    }
    for (TrackingEvent other : events) {
      if (other.canonicalStatus().isRanked()
          && other.canonicalStatus().rank() > status.rank()
          && other.occurredAt().isAfter(event.occurredAt())
          && other.receivedAt().isBefore(event.receivedAt())) {
        return true;
      }
    }
    return false;
  }
}
