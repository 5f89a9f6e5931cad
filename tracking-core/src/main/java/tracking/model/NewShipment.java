package tracking.model;

import java.util.Map;
import java.util.Objects;

/**
 * Registration request for a shipment, handed over by the order management side.
 *
 * @param id           shipment id, or {@code null} to let the engine assign a ULID
 * @param trackingCode unique tracking code
 * @param carrier      carrier identifier
 * @param attributes   attributes available to automation rule conditions
 */
public record NewShipment(String id, String trackingCode, String carrier, Map<String, String> attributes) {

  public NewShipment {
    Objects.requireNonNull(trackingCode, "trackingCode");
    Objects.requireNonNull(carrier, "carrier");
    if (trackingCode.isBlank()) {
      throw new IllegalArgumentException("trackingCode must not be blank");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static NewShipment of(String trackingCode, String carrier) {
    return new NewShipment(null, trackingCode, carrier, Map.of());
  }
}
