package tracking.automation;

import tracking.model.CanonicalStatus;

import java.util.Map;

/**
 * Everything an action needs to know about the transition that fired it.
 *
 * @param invocationId   the invocation being executed; stable across retries, usable as an
 *                       idempotency key by receivers
 * @param shipmentId     the shipment
 * @param trackingCode   the shipment's tracking code, {@code null} if the shipment vanished
 * @param ruleId         the rule that fired
 * @param previousStatus status before the transition
 * @param newStatus      status after the transition
 * @param statusVersion  shipment status version created by the transition
 * @param triggerEventId event that caused the transition, may be {@code null} for reconciliations
 * @param attributes     shipment attributes at execution time
 */
public record TransitionContext(
    String invocationId,
    String shipmentId,
    String trackingCode,
    String ruleId,
    CanonicalStatus previousStatus,
    CanonicalStatus newStatus,
    long statusVersion,
    String triggerEventId,
    Map<String, String> attributes
) {

  public TransitionContext {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
