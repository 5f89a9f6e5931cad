package tracking.normalize;

public enum RejectionReason {
  /** The payload could not be parsed or carried no occurrence code. Goes to review. */
  MALFORMED_PAYLOAD,
  /** No shipment matches the payload's reference yet. Queued for replay. */
  UNRESOLVED_SHIPMENT
}
