package tracking.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <p>The nominal delay is {@code baseDelay * 2^(attempt-1)} capped at {@code maxDelay}; it is
 * then scaled by a random factor in {@code [1 - jitter, 1 + jitter)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private static final double DEFAULT_JITTER = 0.5;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_JITTER);
  }

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay (milliseconds)
   * @param jitter      relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long nominal = baseDelayMs;
    for (int i = 1; i < attempts && nominal < maxDelayMs; i++) {
      nominal = nominal > maxDelayMs / 2 ? maxDelayMs : nominal * 2;
    }
    nominal = Math.min(nominal, maxDelayMs);
    if (jitter == 0.0) {
      return nominal;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (nominal * factor)));
  }
}
