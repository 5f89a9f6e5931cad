package tracking.normalize;

import java.time.Instant;

/**
 * Fields pulled out of a carrier payload before shipment resolution and classification.
 *
 * @param trackingCode   shipment reference found in the payload, may be {@code null}
 * @param occurrenceCode carrier occurrence code, never {@code null}
 * @param occurredAt     parsed occurrence time, {@code null} if missing or unparseable
 * @param carrierEventId carrier-supplied event id, may be {@code null}
 */
public record ExtractedFields(
    String trackingCode,
    String occurrenceCode,
    Instant occurredAt,
    String carrierEventId
) {}
