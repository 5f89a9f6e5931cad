package tracking.dispatch;

import java.time.Instant;

/**
 * Backoff between attempts of an automation invocation, an unresolved event replay or an
 * archive write.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempts attempts made so far, starting at 1
     * @return milliseconds to wait before the next attempt, never negative
     */
    long computeDelayMs(int attempts);

    /**
     * Schedules the next attempt relative to {@code now}.
     *
     * @param now      reference time
     * @param attempts attempts made so far, starting at 1
     * @return when the next attempt becomes due
     */
    default Instant nextAttemptAt(Instant now, int attempts) {
        return now.plusMillis(computeDelayMs(attempts));
    }
}
