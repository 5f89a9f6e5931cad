package tracking.ingest;

import tracking.TrackingStoreException;
import tracking.model.TrackingEvent;
import tracking.model.UnresolvedEvent;
import tracking.model.UnresolvedStatus;
import tracking.normalize.NormalizedEvent;
import tracking.normalize.RejectionReason;
import tracking.spi.ConnectionProvider;
import tracking.spi.EventStore;
import tracking.spi.MetricsExporter;
import tracking.spi.UnresolvedEventStore;
import tracking.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write side of carrier event intake: stores normalized events exactly once and parks
 * rejected payloads for replay or review.
 *
 * <p>Deduplication relies solely on the store's unique constraint on the dedup key; there
 * is no read-then-write window. Storage failures propagate as
 * {@link TrackingStoreException}.
 */
public final class IngestionService {
  private static final Logger logger = Logger.getLogger(IngestionService.class.getName());

  private final ConnectionProvider connectionProvider;
  private final EventStore eventStore;
  private final UnresolvedEventStore unresolvedStore;
  private final MetricsExporter metrics;

  public IngestionService(ConnectionProvider connectionProvider, EventStore eventStore,
      UnresolvedEventStore unresolvedStore, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.unresolvedStore = Objects.requireNonNull(unresolvedStore, "unresolvedStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Stores a normalized event unless its dedup key is already present.
   *
   * @param event the normalized event
   * @return {@link IngestResult#ACCEPTED} or {@link IngestResult#DUPLICATE}
   * @throws TrackingStoreException if the store is unavailable
   */
  public IngestResult ingest(TrackingEvent event) {
    Objects.requireNonNull(event, "event");
    boolean inserted;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      inserted = eventStore.insertIfAbsent(conn, event);
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to store event " + event.dedupKey(), e);
    }
    if (!inserted) {
      metrics.incrementIngestDuplicate();
      logger.log(Level.FINE, "Duplicate event dedupKey={0}", event.dedupKey());
      return IngestResult.DUPLICATE;
    }
    metrics.incrementIngestAccepted();
    if (event.needsReview()) {
      metrics.incrementUnclassified();
      logger.log(Level.WARNING, "Unknown occurrence code {0} for shipment {1}; stored as UNCLASSIFIED",
          new Object[] {event.occurrenceCode(), event.shipmentId()});
    }
    return IngestResult.ACCEPTED;
  }

  /**
   * Persists a rejected payload. Unresolved shipments wait for replay; malformed payloads
   * go straight to review.
   *
   * @param rawPayload the payload exactly as received
   * @param source     carrier integration
   * @param rejected   the normalizer's verdict
   * @param receivedAt original receipt time
   * @return the stored entry
   * @throws TrackingStoreException if the entry cannot be stored
   */
  public UnresolvedEvent recordRejected(String rawPayload, String source,
      NormalizedEvent.Rejected rejected, Instant receivedAt) {
    UnresolvedStatus status = rejected.reason() == RejectionReason.MALFORMED_PAYLOAD
        ? UnresolvedStatus.REVIEW : UnresolvedStatus.PENDING;
    UnresolvedEvent entry = new UnresolvedEvent(Ids.newId(), source, rejected.shipmentHint(),
        rawPayload == null ? "" : rawPayload, rejected.reason().name(), receivedAt, status, 0,
        receivedAt, rejected.detail());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      unresolvedStore.insert(conn, entry);
    } catch (SQLException e) {
      throw new TrackingStoreException("Failed to park rejected payload from " + source, e);
    }
    metrics.incrementIngestRejected();
    logger.log(Level.WARNING, "Rejected payload from source={0} ({1}): {2}",
        new Object[] {source, rejected.reason(), rejected.detail()});
    return entry;
  }
}
