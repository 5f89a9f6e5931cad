package tracking.normalize;

import tracking.model.Shipment;

import java.util.Optional;

/**
 * Finds the shipment a payload refers to, by tracking code or shipment id.
 */
@FunctionalInterface
public interface ShipmentResolver {

  Optional<Shipment> resolve(String reference);
}
