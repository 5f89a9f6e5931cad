package tracking.dispatch;

/**
 * Guards against two dispatcher workers running the same invocation at once, which can
 * happen when the hot path and the poller both enqueue it.
 */
public interface InFlightTracker {

  boolean tryAcquire(String invocationId);

  void release(String invocationId);
}
