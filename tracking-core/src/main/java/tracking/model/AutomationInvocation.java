package tracking.model;

import java.time.Instant;

/**
 * Claim record for one rule firing on one status transition. At most one exists per
 * {@code (shipmentId, ruleId, statusVersion)}.
 */
public record AutomationInvocation(
    String id,
    String shipmentId,
    String ruleId,
    long statusVersion,
    CanonicalStatus previousStatus,
    CanonicalStatus newStatus,
    String triggerEventId,
    InvocationStatus status,
    int attempts,
    Instant nextAttemptAt,
    String lastError,
    Instant createdAt,
    Instant completedAt
) {

  /**
   * Creates a fresh claim in {@link InvocationStatus#PENDING}.
   */
  public static AutomationInvocation pending(String id, String shipmentId, String ruleId,
      long statusVersion, CanonicalStatus previousStatus, CanonicalStatus newStatus,
      String triggerEventId, Instant now) {
    return new AutomationInvocation(id, shipmentId, ruleId, statusVersion, previousStatus,
        newStatus, triggerEventId, InvocationStatus.PENDING, 0, now, null, now, null);
  }
}
