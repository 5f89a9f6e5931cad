package tracking.state;

/**
 * What the status fold did with one event.
 */
public enum Disposition {
  /** The event moved the shipment to its status. */
  APPLIED,
  /** The event confirmed the current status. */
  NO_CHANGE,
  /** The event would move the shipment backwards; recorded, not applied. */
  ANOMALY,
  /** The shipment was already closed; recorded, not applied. */
  TERMINAL_IGNORED,
  /** The event's occurrence code is unknown; recorded, not applied. */
  UNCLASSIFIED
}
