package tracking.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import tracking.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code tracking.ingest} tagged {@code outcome=accepted|duplicate|rejected}</li>
 *   <li>{@code tracking.ingest.unclassified} accepted events with an unknown occurrence code</li>
 *   <li>{@code tracking.status.transitions}, {@code tracking.status.anomalies},
 *       {@code tracking.status.conflicts}</li>
 *   <li>{@code tracking.dispatch.enqueue} tagged {@code path=hot|cold};
 *       {@code tracking.dispatch.enqueue.dropped} for hot queue overflow</li>
 *   <li>{@code tracking.dispatch} tagged {@code result=success|failure|dead}</li>
 *   <li>{@code tracking.action.failures} individual action failures and timeouts</li>
 *   <li>{@code tracking.replay} tagged {@code result=resolved|expired}</li>
 *   <li>{@code tracking.archive.dropped}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code tracking.dispatch.queue.depth} tagged {@code queue=hot|cold}</li>
 *   <li>{@code tracking.dispatch.lag.oldest.ms} age of the oldest due invocation</li>
 *   <li>{@code tracking.archive.queue.depth}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String prefix;
  private final List<Meter> meters = new ArrayList<>();

  private final Counter ingestAccepted;
  private final Counter ingestDuplicate;
  private final Counter ingestRejected;
  private final Counter unclassified;
  private final Counter transitions;
  private final Counter anomalies;
  private final Counter conflicts;
  private final Counter reconcileRequested;
  private final Counter reconcileCompleted;
  private final Counter hotEnqueued;
  private final Counter hotDropped;
  private final Counter coldEnqueued;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter dispatchDead;
  private final Counter actionFailures;
  private final Counter replayResolved;
  private final Counter replayExpired;
  private final Counter archiveDropped;

  private final AtomicInteger hotDepth = new AtomicInteger();
  private final AtomicInteger coldDepth = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private final AtomicInteger archiveDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "tracking"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "tracking");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for running several engines
   * against one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "br.tracking"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty() || namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must be non-empty and not end with '.': " + namePrefix);
    }
    this.prefix = namePrefix;

    this.ingestAccepted = counter("ingest", "Carrier payloads by ingestion outcome", "outcome", "accepted");
    this.ingestDuplicate = counter("ingest", "Carrier payloads by ingestion outcome", "outcome", "duplicate");
    this.ingestRejected = counter("ingest", "Carrier payloads by ingestion outcome", "outcome", "rejected");
    this.unclassified = counter("ingest.unclassified", "Accepted events with an unknown occurrence code");
    this.transitions = counter("status.transitions", "Committed shipment status changes");
    this.anomalies = counter("status.anomalies", "Events that would have regressed a shipment");
    this.conflicts = counter("status.conflicts", "Version conflicts while committing a status change");
    this.reconcileRequested = counter("status.reconcile", "Shipments flagged for status re-derivation",
        "result", "requested");
    this.reconcileCompleted = counter("status.reconcile", "Shipments flagged for status re-derivation",
        "result", "completed");
    this.hotEnqueued = counter("dispatch.enqueue", "Invocations handed to dispatch workers", "path", "hot");
    this.coldEnqueued = counter("dispatch.enqueue", "Invocations handed to dispatch workers", "path", "cold");
    this.hotDropped = counter("dispatch.enqueue.dropped", "Invocations left to the poller (hot queue full)");
    this.dispatchSuccess = counter("dispatch", "Invocation attempts by result", "result", "success");
    this.dispatchFailure = counter("dispatch", "Invocation attempts by result", "result", "failure");
    this.dispatchDead = counter("dispatch", "Invocation attempts by result", "result", "dead");
    this.actionFailures = counter("action.failures", "Notification or webhook failures, including timeouts");
    this.replayResolved = counter("replay", "Parked payloads by replay result", "result", "resolved");
    this.replayExpired = counter("replay", "Parked payloads by replay result", "result", "expired");
    this.archiveDropped = counter("archive.dropped", "Archive records dropped");

    meters.add(Gauge.builder(prefix + ".dispatch.queue.depth", hotDepth, AtomicInteger::get)
        .tag("queue", "hot").register(registry));
    meters.add(Gauge.builder(prefix + ".dispatch.queue.depth", coldDepth, AtomicInteger::get)
        .tag("queue", "cold").register(registry));
    meters.add(Gauge.builder(prefix + ".dispatch.lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .baseUnit("milliseconds").register(registry));
    meters.add(Gauge.builder(prefix + ".archive.queue.depth", archiveDepth, AtomicInteger::get)
        .register(registry));
  }

  private Counter counter(String name, String description, String... tags) {
    Counter counter = Counter.builder(prefix + "." + name)
        .description(description)
        .tags(tags)
        .register(registry);
    meters.add(counter);
    return counter;
  }

  private void increment(Counter counter) {
    if (!closed) {
      counter.increment();
    }
  }

  @Override
  public void incrementIngestAccepted() {
    increment(ingestAccepted);
  }

  @Override
  public void incrementIngestDuplicate() {
    increment(ingestDuplicate);
  }

  @Override
  public void incrementIngestRejected() {
    increment(ingestRejected);
  }

  @Override
  public void incrementUnclassified() {
    increment(unclassified);
  }

  @Override
  public void incrementTransition() {
    increment(transitions);
  }

  @Override
  public void incrementAnomaly() {
    increment(anomalies);
  }

  @Override
  public void incrementStorageConflict() {
    increment(conflicts);
  }

  @Override
  public void incrementReconcileRequested() {
    increment(reconcileRequested);
  }

  @Override
  public void incrementReconcileCompleted() {
    increment(reconcileCompleted);
  }

  @Override
  public void incrementHotEnqueued() {
    increment(hotEnqueued);
  }

  @Override
  public void incrementHotDropped() {
    increment(hotDropped);
  }

  @Override
  public void incrementColdEnqueued() {
    increment(coldEnqueued);
  }

  @Override
  public void incrementDispatchSuccess() {
    increment(dispatchSuccess);
  }

  @Override
  public void incrementDispatchFailure() {
    increment(dispatchFailure);
  }

  @Override
  public void incrementDispatchDead() {
    increment(dispatchDead);
  }

  @Override
  public void incrementActionFailure() {
    increment(actionFailures);
  }

  @Override
  public void incrementReplayResolved() {
    increment(replayResolved);
  }

  @Override
  public void incrementReplayExpired() {
    increment(replayExpired);
  }

  @Override
  public void incrementArchiveDropped() {
    increment(archiveDropped);
  }

  @Override
  public void recordQueueDepths(int hotDepth, int coldDepth) {
    if (closed) return;
    this.hotDepth.set(hotDepth);
    this.coldDepth.set(coldDepth);
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    this.oldestLagMs.set(lagMs);
  }

  @Override
  public void recordArchiveQueueDepth(int depth) {
    if (closed) return;
    this.archiveDepth.set(depth);
  }

  /**
   * Removes every meter this exporter registered. {@link tracking.TrackingEngine#close()}
   * calls this so a stopped engine leaves no stale gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
