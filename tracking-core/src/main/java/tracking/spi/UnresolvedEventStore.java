package tracking.spi;

import tracking.model.UnresolvedEvent;
import tracking.model.UnresolvedStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence contract for the replay and review queue of carrier payloads that could not
 * be attached to a shipment or could not be parsed.
 *
 * @see tracking.jdbc.store.JdbcUnresolvedEventStore
 */
public interface UnresolvedEventStore {

    void insert(Connection conn, UnresolvedEvent event);

    /**
     * Returns PENDING entries whose next attempt is due, oldest first.
     */
    List<UnresolvedEvent> findDue(Connection conn, Instant now, int limit);

    /**
     * Returns PENDING entries whose shipment hint is one of {@code hints}.
     */
    List<UnresolvedEvent> findPendingByHints(Connection conn, Collection<String> hints);

    List<UnresolvedEvent> findByStatus(Connection conn, UnresolvedStatus status, int limit);

    int countByStatus(Connection conn, UnresolvedStatus status);

    int markResolved(Connection conn, String id);

    /**
     * Schedules another replay. Implementations <strong>must</strong> increment {@code attempts}.
     */
    int markRetry(Connection conn, String id, Instant nextAttemptAt, String error);

    int markReview(Connection conn, String id, String error);

    /**
     * Moves a REVIEW entry back to PENDING with a fresh retry window anchored at {@code now}.
     *
     * @return the number of rows updated (0 or 1)
     */
    int requeue(Connection conn, String id, Instant now);
}
