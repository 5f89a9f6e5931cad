package tracking.model;

import java.time.Instant;

/**
 * A raw carrier payload that could not be turned into a {@link TrackingEvent} yet.
 *
 * <p>Entries with reason {@code UNRESOLVED_SHIPMENT} are replayed until their shipment
 * appears or the retry window expires; malformed payloads go straight to
 * {@link UnresolvedStatus#REVIEW}.
 *
 * @param id            ULID
 * @param source        carrier integration
 * @param shipmentHint  explicit hint or extracted tracking code, may be {@code null}
 * @param rawPayload    payload exactly as received
 * @param reason        rejection reason name
 * @param receivedAt    original receipt time; anchors the retry window
 * @param status        queue state
 * @param attempts      replay attempts so far
 * @param nextAttemptAt earliest next replay
 * @param lastError     last rejection detail
 */
public record UnresolvedEvent(
    String id,
    String source,
    String shipmentHint,
    String rawPayload,
    String reason,
    Instant receivedAt,
    UnresolvedStatus status,
    int attempts,
    Instant nextAttemptAt,
    String lastError
) {}
