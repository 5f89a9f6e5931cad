package tracking.state;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of lock stripes; a key always maps to the same stripe. Two keys may share a
 * stripe, which only costs throughput.
 */
public final class KeyedLocks {

  private final ReentrantLock[] stripes;

  public KeyedLocks(int stripeCount) {
    if (stripeCount <= 0) {
      throw new IllegalArgumentException("stripeCount must be > 0");
    }
    this.stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  public ReentrantLock lockFor(String key) {
    return stripes[Math.floorMod(key.hashCode(), stripes.length)];
  }

  int stripeCount() {
    return stripes.length;
  }
}
