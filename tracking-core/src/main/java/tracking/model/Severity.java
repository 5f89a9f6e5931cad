package tracking.model;

/**
 * Operational weight of an occurrence code. {@link #TERMINAL} codes close the shipment.
 */
public enum Severity {
  INFO,
  WARNING,
  EXCEPTION,
  TERMINAL
}
