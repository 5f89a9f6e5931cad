package tracking.automation;

import tracking.model.AutomationRule;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, in-process {@link RuleRepository}. Rules keep their registration order.
 */
public final class InMemoryRuleRepository implements RuleRepository {
  private final Map<String, AutomationRule> rules = new ConcurrentHashMap<>();
  private final Map<String, Long> order = new ConcurrentHashMap<>();
  private long sequence;

  /**
   * Registers or replaces a rule.
   *
   * @param rule the rule
   * @return this repository
   */
  public synchronized InMemoryRuleRepository register(AutomationRule rule) {
    Objects.requireNonNull(rule, "rule");
    order.computeIfAbsent(rule.id(), id -> sequence++);
    rules.put(rule.id(), rule);
    return this;
  }

  public synchronized boolean remove(String ruleId) {
    order.remove(ruleId);
    return rules.remove(ruleId) != null;
  }

  /**
   * Enables or disables a rule. Pending invocations of a disabled rule are marked DEAD
   * when they come up for execution.
   *
   * @return {@code false} if no such rule exists
   */
  public synchronized boolean setEnabled(String ruleId, boolean enabled) {
    AutomationRule rule = rules.get(ruleId);
    if (rule == null) {
      return false;
    }
    rules.put(ruleId, rule.withEnabled(enabled));
    return true;
  }

  @Override
  public List<AutomationRule> all() {
    return rules.values().stream()
        .sorted((a, b) -> Long.compare(order.getOrDefault(a.id(), Long.MAX_VALUE),
            order.getOrDefault(b.id(), Long.MAX_VALUE)))
        .toList();
  }

  @Override
  public Optional<AutomationRule> findById(String ruleId) {
    return Optional.ofNullable(rules.get(ruleId));
  }
}
