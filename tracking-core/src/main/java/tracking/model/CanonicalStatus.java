package tracking.model;

/**
 * Engine-wide shipment status vocabulary that every carrier occurrence code maps onto.
 *
 * <p>Progress statuses carry a rank ({@code CREATED} 0 through {@code RETURNED} 5) used by
 * the state machine to detect regressions. {@link #EXCEPTION} and {@link #UNCLASSIFIED}
 * are unranked: an exception is a detour that does not consume progress, and an
 * unclassified event never moves a shipment at all.
 */
public enum CanonicalStatus {
  CREATED(0),
  COLLECTED(1),
  IN_TRANSIT(2),
  OUT_FOR_DELIVERY(3),
  DELIVERED(4),
  RETURNED(5),
  EXCEPTION(-1),
  UNCLASSIFIED(-1);

  private final int rank;

  CanonicalStatus(int rank) {
    this.rank = rank;
  }

  /**
   * Progress rank, or {@code -1} for unranked statuses.
   *
   * @return the rank
   */
  public int rank() {
    return rank;
  }

  public boolean isRanked() {
    return rank >= 0;
  }

  /**
   * Whether a shipment in this status has reached the end of its lifecycle.
   *
   * @return {@code true} for {@link #DELIVERED} and {@link #RETURNED}
   */
  public boolean isTerminal() {
    return this == DELIVERED || this == RETURNED;
  }
}
