package tracking.archive;

import tracking.model.ArchiveKind;
import tracking.model.ArchiveRecord;
import tracking.model.TrackingEvent;
import tracking.timeline.Timeline;
import tracking.timeline.TimelineEntry;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the flat documents written to the archive.
 *
 * <p>Timeline snapshots flatten entries under indexed keys
 * ({@code entry.0.event_id}, {@code entry.0.disposition}, ...).
 */
public final class ArchiveDocuments {

  private ArchiveDocuments() {}

  public static ArchiveRecord rawEvent(TrackingEvent event, Instant archivedAt) {
    Map<String, String> doc = new LinkedHashMap<>();
    doc.put("event_id", event.id());
    doc.put("shipment_id", event.shipmentId());
    doc.put("source", event.source());
    doc.put("occurrence_code", event.occurrenceCode());
    doc.put("canonical_status", event.canonicalStatus().name());
    doc.put("severity", event.severity().name());
    doc.put("occurred_at", event.occurredAt().toString());
    doc.put("occurred_at_estimated", Boolean.toString(event.occurredAtEstimated()));
    doc.put("received_at", event.receivedAt().toString());
    doc.put("dedup_key", event.dedupKey());
    putIfPresent(doc, "carrier_event_id", event.carrierEventId());
    doc.put("raw_payload", event.rawPayload());
    return new ArchiveRecord(ArchiveKind.RAW_EVENT, event.shipmentId(), event.id(), doc, archivedAt);
  }

  public static ArchiveRecord timelineSnapshot(Timeline timeline, String triggerEventId, Instant archivedAt) {
    Map<String, String> doc = new LinkedHashMap<>();
    doc.put("shipment_id", timeline.shipmentId());
    doc.put("status", timeline.status().name());
    doc.put("entry_count", Integer.toString(timeline.size()));
    List<TimelineEntry> entries = timeline.entries();
    for (int i = 0; i < entries.size(); i++) {
      TimelineEntry entry = entries.get(i);
      String prefix = "entry." + i + ".";
      doc.put(prefix + "event_id", entry.event().id());
      doc.put(prefix + "occurrence_code", entry.event().occurrenceCode());
      doc.put(prefix + "occurred_at", entry.occurredAt().toString());
      doc.put(prefix + "disposition", entry.disposition().name());
      doc.put(prefix + "status_after", entry.statusAfter().name());
    }
    return new ArchiveRecord(ArchiveKind.TIMELINE_SNAPSHOT, timeline.shipmentId(), triggerEventId, doc,
        archivedAt);
  }

  private static void putIfPresent(Map<String, String> doc, String key, String value) {
    if (value != null) {
      doc.put(key, value);
    }
  }
}
