package tracking.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Document mirrored to the archival store. Never read back by the engine.
 *
 * @param kind       what the document captures
 * @param shipmentId owning shipment
 * @param eventId    source event, or the triggering event for snapshots; may be {@code null}
 * @param document   flat document body
 * @param archivedAt capture time
 */
public record ArchiveRecord(
    ArchiveKind kind,
    String shipmentId,
    String eventId,
    Map<String, String> document,
    Instant archivedAt
) {

  public ArchiveRecord {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(shipmentId, "shipmentId");
    Objects.requireNonNull(archivedAt, "archivedAt");
    document = document == null ? Map.of() : Map.copyOf(document);
  }
}
