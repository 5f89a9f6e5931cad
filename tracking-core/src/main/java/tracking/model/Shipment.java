package tracking.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A tracked shipment. The status fields are written only by the status engine, through a
 * version-checked update.
 *
 * @param id                   shipment id
 * @param trackingCode         unique carrier-facing tracking code
 * @param carrier              carrier identifier used for occurrence code lookup
 * @param currentStatus        derived status, never {@link CanonicalStatus#UNCLASSIFIED}
 * @param currentStatusVersion incremented on every stored status change
 * @param lastEventId          event that triggered the last stored change, may be {@code null}
 * @param attributes           free-form attributes evaluated by automation rule conditions
 * @param createdAt            creation time
 * @param updatedAt            last status change time
 */
public record Shipment(
    String id,
    String trackingCode,
    String carrier,
    CanonicalStatus currentStatus,
    long currentStatusVersion,
    String lastEventId,
    Map<String, String> attributes,
    Instant createdAt,
    Instant updatedAt
) {

  public Shipment {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(trackingCode, "trackingCode");
    Objects.requireNonNull(carrier, "carrier");
    Objects.requireNonNull(currentStatus, "currentStatus");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
