package tracking.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configured reaction to status transitions.
 *
 * @param id              stable rule id; part of the invocation uniqueness key
 * @param name            display name
 * @param triggerStatuses statuses whose arrival fires the rule
 * @param condition       extra predicate over shipment attributes
 * @param actions         actions, executed in declared order
 * @param enabled         disabled rules never fire and their pending claims are abandoned
 */
public record AutomationRule(
    String id,
    String name,
    Set<CanonicalStatus> triggerStatuses,
    RuleCondition condition,
    List<AutomationAction> actions,
    boolean enabled
) {

  public AutomationRule {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(triggerStatuses, "triggerStatuses");
    Objects.requireNonNull(actions, "actions");
    if (triggerStatuses.isEmpty()) {
      throw new IllegalArgumentException("rule " + id + " has no trigger statuses");
    }
    if (triggerStatuses.contains(CanonicalStatus.UNCLASSIFIED)) {
      throw new IllegalArgumentException("rule " + id + " cannot trigger on UNCLASSIFIED");
    }
    name = name == null ? id : name;
    triggerStatuses = Set.copyOf(EnumSet.copyOf(triggerStatuses));
    condition = condition == null ? RuleCondition.always() : condition;
    actions = List.copyOf(actions);
  }

  /**
   * Returns whether this rule fires for a shipment that just reached {@code status}.
   *
   * @param status     the new status
   * @param attributes the shipment's attributes
   * @return {@code true} if enabled, triggered by the status and the condition holds
   */
  public boolean matches(CanonicalStatus status, Map<String, String> attributes) {
    return enabled && triggerStatuses.contains(status) && condition.test(attributes);
  }

  public AutomationRule withEnabled(boolean enabled) {
    return new AutomationRule(id, name, triggerStatuses, condition, actions, enabled);
  }
}
