package tracking.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single normalized carrier occurrence for one shipment. Immutable once persisted.
 *
 * <p>The classification ({@code canonicalStatus}, {@code severity}, {@code terminal}) is a
 * snapshot taken at ingestion time; later registry reloads do not rewrite history.
 *
 * @param id                  ULID, time-ordered
 * @param shipmentId          owning shipment
 * @param occurrenceCode      normalized carrier code
 * @param canonicalStatus     classification, {@link CanonicalStatus#UNCLASSIFIED} for unknown codes
 * @param severity            classification severity ({@link Severity#WARNING} when unclassified)
 * @param terminal            whether the classification closes the shipment
 * @param source              carrier integration the payload came from
 * @param carrierEventId      carrier-supplied event identifier, may be {@code null}
 * @param occurredAt          when the occurrence happened (carrier clock)
 * @param receivedAt          when the engine received the payload
 * @param occurredAtEstimated {@code true} when {@code occurredAt} fell back to {@code receivedAt}
 * @param dedupKey            unique deduplication key
 * @param rawPayload          payload exactly as received
 * @param needsReview         flagged for human attention (unknown code)
 */
public record TrackingEvent(
    String id,
    String shipmentId,
    String occurrenceCode,
    CanonicalStatus canonicalStatus,
    Severity severity,
    boolean terminal,
    String source,
    String carrierEventId,
    Instant occurredAt,
    Instant receivedAt,
    boolean occurredAtEstimated,
    String dedupKey,
    String rawPayload,
    boolean needsReview
) {

  public TrackingEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(shipmentId, "shipmentId");
    Objects.requireNonNull(occurrenceCode, "occurrenceCode");
    Objects.requireNonNull(canonicalStatus, "canonicalStatus");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(receivedAt, "receivedAt");
    Objects.requireNonNull(dedupKey, "dedupKey");
  }

  public boolean unclassified() {
    return canonicalStatus == CanonicalStatus.UNCLASSIFIED;
  }
}
