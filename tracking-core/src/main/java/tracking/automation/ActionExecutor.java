package tracking.automation;

import tracking.model.ActionKind;
import tracking.model.AutomationAction;
import tracking.spi.NotificationSender;
import tracking.spi.WebhookClient;
import tracking.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single automation action under a bounded timeout.
 *
 * <p>Action kinds form a closed set; each kind delegates to its SPI
 * ({@link NotificationSender}, {@link WebhookClient}). Any failure, including a timeout or a
 * missing SPI, surfaces as {@link ActionFailureException}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ActionExecutor implements AutoCloseable {

  private final NotificationSender notificationSender;
  private final WebhookClient webhookClient;
  private final long timeoutMs;
  private final ExecutorService runner;

  private ActionExecutor(Builder builder) {
    this.notificationSender = builder.notificationSender;
    this.webhookClient = builder.webhookClient;
    Duration timeout = builder.actionTimeout;
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("actionTimeout must be > 0");
    }
    this.timeoutMs = timeout.toMillis();
    this.runner = Executors.newCachedThreadPool(new DaemonThreadFactory("tracking-action-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes one action and waits for it, at most for the configured timeout.
   *
   * @param action  the action
   * @param context the transition that fired it
   * @throws ActionFailureException if the action failed, timed out or has no delegate
   */
  public void execute(AutomationAction action, TransitionContext context) {
    Callable<Void> call = switch (action.kind()) {
      case NOTIFY -> notifyCall((AutomationAction.Notify) action, context);
      case WEBHOOK -> webhookCall((AutomationAction.Webhook) action, context);
    };
    Future<Void> future = runner.submit(call);
    try {
      future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new ActionFailureException(action.kind(),
          action.kind() + " action timed out after " + timeoutMs + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof ActionFailureException afe) {
        throw afe;
      }
      throw new ActionFailureException(action.kind(),
          action.kind() + " action failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ActionFailureException(action.kind(), action.kind() + " action interrupted", e);
    }
  }

  private Callable<Void> notifyCall(AutomationAction.Notify action, TransitionContext context) {
    if (notificationSender == null) {
      throw new ActionFailureException(ActionKind.NOTIFY, "No NotificationSender configured");
    }
    return () -> {
      notificationSender.send(action, context.shipmentId(), context.newStatus(), context);
      return null;
    };
  }

  private Callable<Void> webhookCall(AutomationAction.Webhook action, TransitionContext context) {
    if (webhookClient == null) {
      throw new ActionFailureException(ActionKind.WEBHOOK, "No WebhookClient configured");
    }
    return () -> {
      webhookClient.post(action, context.shipmentId(), context.newStatus(), context);
      return null;
    };
  }

  @Override
  public void close() {
    runner.shutdownNow();
  }

  /** Builder for {@link ActionExecutor}. */
  public static final class Builder {
    private NotificationSender notificationSender;
    private WebhookClient webhookClient;
    private Duration actionTimeout = Duration.ofSeconds(10);

    private Builder() {}

    /**
     * Sets the delegate for {@code NOTIFY} actions.
     *
     * <p>Optional. Without one, every {@code NOTIFY} action fails.
     *
     * @param notificationSender the sender
     * @return this builder
     */
    public Builder notificationSender(NotificationSender notificationSender) {
      this.notificationSender = notificationSender;
      return this;
    }

    /**
     * Sets the delegate for {@code WEBHOOK} actions.
     *
     * <p>Optional. Without one, every {@code WEBHOOK} action fails.
     *
     * @param webhookClient the client
     * @return this builder
     */
    public Builder webhookClient(WebhookClient webhookClient) {
      this.webhookClient = webhookClient;
      return this;
    }

    /**
     * Sets the per-action timeout.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param actionTimeout the timeout
     * @return this builder
     */
    public Builder actionTimeout(Duration actionTimeout) {
      this.actionTimeout = actionTimeout;
      return this;
    }

    public ActionExecutor build() {
      return new ActionExecutor(this);
    }
  }
}
