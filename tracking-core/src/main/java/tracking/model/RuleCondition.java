package tracking.model;

import java.util.Map;
import java.util.Objects;

/**
 * Predicate over a shipment's attributes, evaluated when a rule's trigger status is reached.
 */
@FunctionalInterface
public interface RuleCondition {

  boolean test(Map<String, String> attributes);

  static RuleCondition always() {
    return attributes -> true;
  }

  static RuleCondition attributeEquals(String key, String value) {
    Objects.requireNonNull(key, "key");
    return attributes -> Objects.equals(attributes.get(key), value);
  }

  static RuleCondition hasAttribute(String key) {
    Objects.requireNonNull(key, "key");
    return attributes -> attributes.containsKey(key);
  }

  default RuleCondition and(RuleCondition other) {
    Objects.requireNonNull(other, "other");
    return attributes -> test(attributes) && other.test(attributes);
  }
}
