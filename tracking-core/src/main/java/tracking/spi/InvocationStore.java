package tracking.spi;

import tracking.model.AutomationInvocation;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for automation invocations, managing status transitions through
 * the lifecycle: PENDING → DONE, PENDING → RETRY → DONE, or → DEAD.
 *
 * @see tracking.jdbc.store.JdbcInvocationStore
 */
public interface InvocationStore {

    /**
     * Claims an invocation. The {@code (shipmentId, ruleId, statusVersion)} triple is unique;
     * a second claim for the same triple is a no-op.
     *
     * @param conn       the JDBC connection (inside the transition transaction)
     * @param invocation the pending invocation
     * @return {@code true} if claimed, {@code false} if the triple was already claimed
     */
    boolean claim(Connection conn, AutomationInvocation invocation);

    /**
     * Marks an invocation done. The three {@code mark*} transitions only apply to PENDING and
     * RETRY rows; a row already DONE or DEAD is left untouched and 0 is returned.
     */
    int markDone(Connection conn, String invocationId, Instant completedAt);

    /**
     * Schedules a retry. Implementations <strong>must</strong> increment {@code attempts}.
     */
    int markRetry(Connection conn, String invocationId, Instant nextAttemptAt, String error);

    int markDead(Connection conn, String invocationId, String error);

    /**
     * Returns PENDING and RETRY invocations due at {@code now}, oldest first, skipping rows
     * created within {@code skipRecent} (still on their way through the hot path).
     */
    List<AutomationInvocation> pollPending(Connection conn, Instant now, Duration skipRecent, int limit);

    Optional<AutomationInvocation> findById(Connection conn, String invocationId);

    List<AutomationInvocation> findByShipment(Connection conn, String shipmentId);
}
