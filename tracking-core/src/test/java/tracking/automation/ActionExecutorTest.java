package tracking.automation;

import org.junit.jupiter.api.Test;
import tracking.model.ActionKind;
import tracking.model.AutomationAction;
import tracking.model.CanonicalStatus;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ActionExecutorTest {

  private static final TransitionContext CONTEXT = new TransitionContext("inv-1", "S1", "TRK1", "r1",
      CanonicalStatus.OUT_FOR_DELIVERY, CanonicalStatus.DELIVERED, 4L, "E1", Map.of("email", "a@b.c"));

  @Test
  void notifyActionReachesSender() {
    List<String> sent = new CopyOnWriteArrayList<>();
    try (ActionExecutor executor = ActionExecutor.builder()
        .notificationSender((action, shipmentId, status, ctx) ->
            sent.add(action.channel() + ":" + shipmentId + ":" + status + ":" + ctx.invocationId()))
        .build()) {
      executor.execute(new AutomationAction.Notify("email", "${email}", "delivered"), CONTEXT);
    }

    assertEquals(List.of("email:S1:DELIVERED:inv-1"), sent);
  }

  @Test
  void webhookActionReachesClient() {
    List<String> posted = new CopyOnWriteArrayList<>();
    try (ActionExecutor executor = ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> posted.add(action.url()))
        .build()) {
      executor.execute(new AutomationAction.Webhook("http://crm/hook"), CONTEXT);
    }

    assertEquals(List.of("http://crm/hook"), posted);
  }

  @Test
  void missingSenderFailsTheAction() {
    try (ActionExecutor executor = ActionExecutor.builder().build()) {
      ActionFailureException e = assertThrows(ActionFailureException.class,
          () -> executor.execute(new AutomationAction.Notify("sms", "123", "t"), CONTEXT));
      assertEquals(ActionKind.NOTIFY, e.kind());
    }
  }

  @Test
  void checkedFailureIsWrapped() {
    try (ActionExecutor executor = ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> {
          throw new IOException("connection refused");
        })
        .build()) {
      ActionFailureException e = assertThrows(ActionFailureException.class,
          () -> executor.execute(new AutomationAction.Webhook("http://down"), CONTEXT));
      assertEquals(ActionKind.WEBHOOK, e.kind());
      assertInstanceOf(IOException.class, e.getCause());
      assertTrue(e.getMessage().contains("connection refused"));
    }
  }

  @Test
  void slowActionTimesOutAndIsInterrupted() throws Exception {
    CountDownLatch interrupted = new CountDownLatch(1);
    try (ActionExecutor executor = ActionExecutor.builder()
        .webhookClient((action, shipmentId, status, ctx) -> {
          try {
            Thread.sleep(10_000);
          } catch (InterruptedException e) {
            interrupted.countDown();
            throw e;
          }
        })
        .actionTimeout(Duration.ofMillis(100))
        .build()) {
      long start = System.nanoTime();
      ActionFailureException e = assertThrows(ActionFailureException.class,
          () -> executor.execute(new AutomationAction.Webhook("http://slow"), CONTEXT));
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      assertTrue(e.getMessage().contains("timed out"));
      assertTrue(elapsedMs < 5_000, "took " + elapsedMs + " ms");
      assertTrue(interrupted.await(3, TimeUnit.SECONDS));
    }
  }

  @Test
  void timeoutMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> ActionExecutor.builder().actionTimeout(Duration.ZERO).build());
  }
}
