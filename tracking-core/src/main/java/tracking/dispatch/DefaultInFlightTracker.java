package tracking.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional expiry.
 *
 * <p>With {@code ttlMs == 0} an id stays acquired until released. With a positive TTL an
 * entry older than the TTL can be taken over, so an invocation held by a wedged worker is
 * eventually retried.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Long> acquiredAt = new ConcurrentHashMap<>();
    private final long ttlMs;

    public DefaultInFlightTracker() {
        this(0L);
    }

    /**
     * @param ttlMs time after which an acquired id can be taken over; {@code 0} for never
     */
    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0");
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public boolean tryAcquire(String invocationId) {
        long now = System.currentTimeMillis();
        boolean[] acquired = new boolean[1];
        acquiredAt.compute(invocationId, (id, since) -> {
            if (since == null || (ttlMs > 0 && now - since > ttlMs)) {
                acquired[0] = true;
                return now;
            }
            return since;
        });
        return acquired[0];
    }

    @Override
    public void release(String invocationId) {
        acquiredAt.remove(invocationId);
    }

    int size() {
        return acquiredAt.size();
    }
}
