package tracking.automation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tracking.dispatch.ExponentialBackoffRetryPolicy;
import tracking.dispatch.InFlightTracker;
import tracking.model.AutomationAction;
import tracking.model.AutomationInvocation;
import tracking.model.AutomationRule;
import tracking.model.CanonicalStatus;
import tracking.model.InvocationStatus;
import tracking.support.InMemoryStores;
import tracking.support.RecordingMetrics;
import tracking.support.TestEvents;
import tracking.util.Ids;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AutomationDispatcherTest {

  private InMemoryStores.Invocations invocations;
  private InMemoryStores.Shipments shipments;
  private InMemoryRuleRepository rules;
  private RecordingMetrics metrics;
  private final List<TransitionContext> posted = new CopyOnWriteArrayList<>();
  private final AtomicInteger webhookFailures = new AtomicInteger();

  @BeforeEach
  void setUp() {
    invocations = new InMemoryStores.Invocations();
    shipments = new InMemoryStores.Shipments();
    rules = new InMemoryRuleRepository();
    metrics = new RecordingMetrics();
    shipments.insert(null, TestEvents.shipment("S1", "TRK1", Map.of("email", "a@b.c")));
    rules.register(new AutomationRule("r1", "on delivery", Set.of(CanonicalStatus.DELIVERED), null,
        List.of(new AutomationAction.Webhook("http://crm/hook")), true));
  }

  private ActionExecutor executor() {
    return ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> {
          if (webhookFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IOException("HTTP 503");
          }
          posted.add(ctx);
        })
        .build();
  }

  private AutomationDispatcher.Builder dispatcher(ActionExecutor executor) {
    return AutomationDispatcher.builder()
        .connectionProvider(InMemoryStores.connections())
        .invocationStore(invocations)
        .shipmentStore(shipments)
        .ruleRepository(rules)
        .actionExecutor(executor)
        .retryPolicy(new ExponentialBackoffRetryPolicy(1000, 10_000, 0.0))
        .metrics(metrics);
  }

  private AutomationInvocation claim(String ruleId) {
    AutomationInvocation invocation = AutomationInvocation.pending(Ids.newId(), "S1", ruleId, 1L,
        CanonicalStatus.OUT_FOR_DELIVERY, CanonicalStatus.DELIVERED, "E1", Instant.now());
    invocations.claim(null, invocation);
    return invocation;
  }

  // ── Direct dispatch ───────────────────────────────────────────

  @Test
  void successfulActionsMarkInvocationDone() {
    AutomationInvocation invocation = claim("r1");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.DONE, after.status());
    assertNotNull(after.completedAt());
    assertEquals(1, posted.size());
    TransitionContext ctx = posted.get(0);
    assertEquals(invocation.id(), ctx.invocationId());
    assertEquals("TRK1", ctx.trackingCode());
    assertEquals("a@b.c", ctx.attributes().get("email"));
    assertEquals(1, metrics.count("dispatchSuccess"));
  }

  @Test
  void failedActionSchedulesRetryWithBackoff() {
    webhookFailures.set(1);
    AutomationInvocation invocation = claim("r1");
    Instant before = Instant.now();

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.RETRY, after.status());
    assertEquals(1, after.attempts());
    assertFalse(after.nextAttemptAt().isBefore(before.plusMillis(1000)));
    assertTrue(after.lastError().startsWith("WEBHOOK: "));
    assertTrue(after.lastError().contains("HTTP 503"));
    assertEquals(1, metrics.count("dispatchFailure"));
    assertEquals(1, metrics.count("actionFailure"));
  }

  @Test
  void exhaustedAttemptsMarkInvocationDead() {
    webhookFailures.set(100);
    AutomationInvocation invocation = claim("r1");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).maxAttempts(3).build()) {
      for (int i = 0; i < 3; i++) {
        dispatcher.dispatch(invocations.byId.get(invocation.id()));
      }
    }

    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.DEAD, after.status());
    assertEquals(3, after.attempts());
    assertEquals(2, metrics.count("dispatchFailure"));
    assertEquals(1, metrics.count("dispatchDead"));
  }

  @Test
  void disabledRuleAbandonsInvocation() {
    AutomationInvocation invocation = claim("r1");
    rules.setEnabled("r1", false);

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    assertEquals(InvocationStatus.DEAD, invocations.byId.get(invocation.id()).status());
    assertTrue(posted.isEmpty());
    assertEquals(1, metrics.count("dispatchDead"));
  }

  @Test
  void missingRuleAbandonsInvocation() {
    AutomationInvocation invocation = claim("deleted");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.DEAD, after.status());
    assertTrue(after.lastError().contains("deleted"));
  }

  @Test
  void allActionsRunEvenWhenOneFails() {
    List<String> notified = new CopyOnWriteArrayList<>();
    rules.register(new AutomationRule("r2", "two actions", Set.of(CanonicalStatus.DELIVERED), null,
        List.of(new AutomationAction.Webhook("http://down"),
            new AutomationAction.Notify("email", "${email}", "delivered")), true));
    AutomationInvocation invocation = claim("r2");

    try (ActionExecutor executor = ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> {
          throw new IOException("down");
        })
        .notificationSender((action, shipmentId, status, ctx) -> notified.add(action.channel()))
        .build();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    assertEquals(List.of("email"), notified);
    assertEquals(InvocationStatus.RETRY, invocations.byId.get(invocation.id()).status());
  }

  @Test
  void inFlightInvocationIsSkipped() {
    AutomationInvocation invocation = claim("r1");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor)
             .workerCount(0)
             .inFlightTracker(new InFlightTracker() {
               @Override
               public boolean tryAcquire(String invocationId) {
                 return false;
               }

               @Override
               public void release(String invocationId) {
               }
             })
             .build()) {
      dispatcher.dispatch(invocation);
    }

    assertTrue(posted.isEmpty());
    assertEquals(InvocationStatus.PENDING, invocations.byId.get(invocation.id()).status());
  }

  @Test
  void staleCopyOfDoneInvocationRunsNoActions() {
    AutomationInvocation invocation = claim("r1");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
      // same snapshot again, as a cold-queue copy polled before the hot path finished
      dispatcher.dispatch(invocation);
    }

    assertEquals(1, posted.size());
    assertEquals(InvocationStatus.DONE, invocations.byId.get(invocation.id()).status());
    assertEquals(1, metrics.count("dispatchSuccess"));
  }

  @Test
  void staleCopyOfDeadInvocationIsNotRevived() {
    AutomationInvocation invocation = claim("r1");
    invocations.markDead(null, invocation.id(), "gave up");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build()) {
      dispatcher.dispatch(invocation);
    }

    assertTrue(posted.isEmpty());
    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.DEAD, after.status());
    assertEquals("gave up", after.lastError());
  }

  @Test
  void retriedInvocationUsesStoredAttemptCount() {
    webhookFailures.set(100);
    AutomationInvocation invocation = claim("r1");
    invocations.markRetry(null, invocation.id(), Instant.now(), "earlier");
    invocations.markRetry(null, invocation.id(), Instant.now(), "earlier");

    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).maxAttempts(3).build()) {
      dispatcher.dispatch(invocation);
    }

    AutomationInvocation after = invocations.byId.get(invocation.id());
    assertEquals(InvocationStatus.DEAD, after.status());
    assertEquals(3, after.attempts());
  }

  @Test
  void terminalInvocationsIgnoreFurtherTransitions() {
    AutomationInvocation invocation = claim("r1");
    assertEquals(1, invocations.markDone(null, invocation.id(), Instant.now()));

    assertEquals(0, invocations.markRetry(null, invocation.id(), Instant.now(), "late"));
    assertEquals(0, invocations.markDead(null, invocation.id(), "late"));
    assertEquals(0, invocations.markDone(null, invocation.id(), Instant.now()));
    assertEquals(InvocationStatus.DONE, invocations.byId.get(invocation.id()).status());
  }

  // ── Worker threads ────────────────────────────────────────────

  @Test
  void zeroWorkersStartsNoThreadsAndClosesCleanly() {
    long before = dispatcherThreads();
    try (ActionExecutor executor = executor()) {
      AutomationDispatcher dispatcher = dispatcher(executor).workerCount(0).build();
      assertTrue(dispatcher.enqueueHot(claim("r1")));
      assertTrue(dispatcherThreads() <= before);

      dispatcher.close();
      dispatcher.close();

      assertFalse(dispatcher.enqueueHot(claim("r1")));
    }
    assertTrue(posted.isEmpty());
  }

  private static long dispatcherThreads() {
    return Thread.getAllStackTraces().keySet().stream()
        .filter(t -> t.getName().startsWith("tracking-dispatcher-"))
        .count();
  }

  @Test
  void workersDrainHotAndColdQueues() throws Exception {
    CountDownLatch done = new CountDownLatch(2);
    try (ActionExecutor executor = ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> done.countDown())
        .build();
         AutomationDispatcher dispatcher = dispatcher(executor).workerCount(2).build()) {
      assertTrue(dispatcher.enqueueHot(claim("r1")));
      assertTrue(dispatcher.enqueueCold(claim("r1")));

      assertTrue(done.await(3, TimeUnit.SECONDS));
    }

    assertEquals(2, invocations.withStatus(InvocationStatus.DONE).size());
  }

  @Test
  void fullQueueRejectsEnqueue() {
    try (ActionExecutor executor = executor();
         AutomationDispatcher dispatcher = dispatcher(executor)
             .workerCount(0)
             .hotQueueCapacity(1)
             .coldQueueCapacity(1)
             .build()) {
      assertTrue(dispatcher.enqueueHot(claim("r1")));
      assertFalse(dispatcher.enqueueHot(claim("r1")));
      assertTrue(dispatcher.enqueueCold(claim("r1")));
      assertEquals(0, dispatcher.coldQueueRemainingCapacity());
      assertEquals(1, metrics.lastHotDepth);
    }
  }

  @Test
  void closedDispatcherRejectsEnqueue() {
    try (ActionExecutor executor = executor()) {
      AutomationDispatcher dispatcher = dispatcher(executor).workerCount(1).build();
      dispatcher.close();

      assertFalse(dispatcher.enqueueHot(claim("r1")));
      assertFalse(dispatcher.enqueueCold(claim("r1")));
    }
  }

  @Test
  void closeDrainsQueuedInvocations() {
    try (ActionExecutor executor = executor()) {
      AutomationDispatcher dispatcher = dispatcher(executor).workerCount(1).build();
      for (int i = 0; i < 5; i++) {
        dispatcher.enqueueHot(claim("r1"));
      }
      dispatcher.close();
    }

    assertEquals(5, invocations.withStatus(InvocationStatus.DONE).size());
  }

  @Test
  void invalidConfigurationIsRejected() {
    try (ActionExecutor executor = executor()) {
      assertThrows(IllegalArgumentException.class, () -> dispatcher(executor).maxAttempts(0).build());
      assertThrows(IllegalArgumentException.class, () -> dispatcher(executor).hotQueueCapacity(0).build());
      assertThrows(NullPointerException.class, () -> AutomationDispatcher.builder().build());
    }
  }
}
