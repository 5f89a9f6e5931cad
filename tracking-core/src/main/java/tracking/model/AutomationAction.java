package tracking.model;

import java.util.Map;
import java.util.Objects;

/**
 * A side effect an automation rule performs when it fires. The set of kinds is closed.
 */
public sealed interface AutomationAction permits AutomationAction.Notify, AutomationAction.Webhook {

  ActionKind kind();

  /**
   * Sends a notification through a channel such as e-mail or WhatsApp.
   *
   * @param channel   delivery channel understood by the configured sender
   * @param recipient address, phone number or attribute placeholder ({@code ${attr}})
   * @param template  message template name or body
   */
  record Notify(String channel, String recipient, String template) implements AutomationAction {
    public Notify {
      Objects.requireNonNull(channel, "channel");
      Objects.requireNonNull(recipient, "recipient");
      Objects.requireNonNull(template, "template");
    }

    @Override
    public ActionKind kind() {
      return ActionKind.NOTIFY;
    }
  }

  /**
   * Posts the transition to an HTTP endpoint.
   *
   * @param url     target URL
   * @param headers extra request headers
   */
  record Webhook(String url, Map<String, String> headers) implements AutomationAction {
    public Webhook {
      Objects.requireNonNull(url, "url");
      headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public Webhook(String url) {
      this(url, Map.of());
    }

    @Override
    public ActionKind kind() {
      return ActionKind.WEBHOOK;
    }
  }
}
