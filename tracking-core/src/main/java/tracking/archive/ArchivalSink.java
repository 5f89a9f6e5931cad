package tracking.archive;

import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.dispatch.RetryPolicy;
import tracking.model.ArchiveRecord;
import tracking.spi.ArchiveStore;
import tracking.spi.MetricsExporter;
import tracking.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asynchronous, best-effort mirror of raw events and timeline snapshots into an
 * {@link ArchiveStore}.
 *
 * <p>{@link #offer} never blocks and never throws: when the bounded queue is full the record
 * is dropped with a warning. A single daemon worker writes records in arrival order,
 * retrying a failed write with backoff up to {@code maxRetries} times before dropping it.
 *
 * <p>Create instances via {@link #builder()}. Implements {@link AutoCloseable}; closing
 * drains the queue within the configured drain timeout.
 */
public final class ArchivalSink implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ArchivalSink.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 100;

  private final ArchiveStore archiveStore;
  private final BlockingQueue<ArchiveRecord> queue;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;
  private final ExecutorService worker;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicBoolean accepting = new AtomicBoolean(true);

  private ArchivalSink(Builder builder) {
    this.archiveStore = Objects.requireNonNull(builder.archiveStore, "archiveStore");
    if (builder.capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.queue = new ArrayBlockingQueue<>(builder.capacity);
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(100, 5_000);
    this.maxRetries = builder.maxRetries;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("tracking-archiver-"));
    worker.submit(this::workerLoop);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues a record for archival.
   *
   * @param record the record
   * @return {@code false} if the record was dropped (queue full or sink closed)
   */
  public boolean offer(ArchiveRecord record) {
    if (record == null) {
      return false;
    }
    if (!accepting.get() || !queue.offer(record)) {
      metrics.incrementArchiveDropped();
      logger.log(Level.WARNING, "Archive record dropped: kind={0}, shipment={1}, event={2}",
          new Object[] {record.kind(), record.shipmentId(), record.eventId()});
      return false;
    }
    metrics.recordArchiveQueueDepth(queue.size());
    return true;
  }

  public int queueDepth() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        ArchiveRecord record = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (record == null) {
          if (!running.get()) break;
          continue;
        }
        write(record);
        metrics.recordArchiveQueueDepth(queue.size());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Archiver loop error", t);
      }
    }
  }

  private void write(ArchiveRecord record) throws InterruptedException {
    for (int attempt = 1; ; attempt++) {
      try {
        archiveStore.write(record);
        return;
      } catch (Exception e) {
        if (attempt > maxRetries) {
          metrics.incrementArchiveDropped();
          logger.log(Level.SEVERE, "Archive write failed after " + attempt + " attempts; dropping "
              + record.kind() + " for shipment " + record.shipmentId(), e);
          return;
        }
        logger.log(Level.FINE, "Archive write attempt {0} failed: {1}",
            new Object[] {attempt, e.getMessage()});
        Thread.sleep(retryPolicy.computeDelayMs(attempt));
      }
    }
  }

  /**
   * Stops accepting records and waits for the queue to drain, at most the drain timeout.
   */
  @Override
  public void close() {
    accepting.set(false);
    running.set(false);
    worker.shutdown();
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Archive drain timeout exceeded; {0} records not archived",
            queue.size());
        worker.shutdownNow();
        worker.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ArchivalSink}. */
  public static final class Builder {
    private ArchiveStore archiveStore;
    private int capacity = 10_000;
    private int maxRetries = 3;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the destination store.
     *
     * <p><b>Required.</b>
     *
     * @param archiveStore the store
     * @return this builder
     */
    public Builder archiveStore(ArchiveStore archiveStore) {
      this.archiveStore = archiveStore;
      return this;
    }

    /**
     * Sets the bounded queue capacity.
     *
     * <p>Optional. Defaults to {@code 10000}.
     *
     * @param capacity maximum queued records
     * @return this builder
     */
    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /**
     * Sets how many times a failed write is retried before the record is dropped.
     *
     * <p>Optional. Defaults to {@code 3}.
     *
     * @param maxRetries retries after the first attempt
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the backoff between write attempts.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} from 100 ms up to 5 s.
     *
     * @param retryPolicy backoff between write attempts
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public ArchivalSink build() {
      return new ArchivalSink(this);
    }
  }
}
