package tracking.automation;

import tracking.model.AutomationRule;
import tracking.model.CanonicalStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of automation rules. Consulted when a transition commits (which rules fire) and
 * again when an invocation executes (is the rule still there and enabled).
 *
 * @see InMemoryRuleRepository
 */
public interface RuleRepository {

  List<AutomationRule> all();

  Optional<AutomationRule> findById(String ruleId);

  /**
   * Returns the rules that fire for a shipment reaching {@code status}.
   *
   * @param status     the new status
   * @param attributes the shipment's attributes
   * @return matching enabled rules, in repository order
   */
  default List<AutomationRule> matching(CanonicalStatus status, Map<String, String> attributes) {
    return all().stream().filter(rule -> rule.matches(status, attributes)).toList();
  }
}
