package tracking.automation;

import tracking.model.AutomationAction;
import tracking.model.CanonicalStatus;
import tracking.spi.WebhookClient;
import tracking.util.JsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link WebhookClient} on top of {@link HttpClient}: POSTs the transition as a flat JSON
 * object and treats any non-2xx response as a failure.
 *
 * <p>The body carries the invocation id as {@code invocation_id}; receivers should use it to
 * discard redeliveries after a retry.
 */
public final class HttpWebhookClient implements WebhookClient {

  private final HttpClient httpClient;
  private final Duration requestTimeout;
  private final JsonCodec jsonCodec;

  public HttpWebhookClient() {
    this(Duration.ofSeconds(5));
  }

  public HttpWebhookClient(Duration requestTimeout) {
    this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), requestTimeout,
        JsonCodec.getDefault());
  }

  public HttpWebhookClient(HttpClient httpClient, Duration requestTimeout, JsonCodec jsonCodec) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void post(AutomationAction.Webhook action, String shipmentId, CanonicalStatus newStatus,
      TransitionContext context) throws IOException, InterruptedException {
    HttpRequest.Builder request = HttpRequest.newBuilder()
        .uri(URI.create(action.url()))
        .timeout(requestTimeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(jsonCodec.toJson(body(shipmentId, newStatus, context))));
    action.headers().forEach(request::header);

    HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() / 100 != 2) {
      throw new IOException("Webhook " + action.url() + " returned HTTP " + response.statusCode());
    }
  }

  static Map<String, String> body(String shipmentId, CanonicalStatus newStatus, TransitionContext context) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("invocation_id", context.invocationId());
    body.put("shipment_id", shipmentId);
    if (context.trackingCode() != null) {
      body.put("tracking_code", context.trackingCode());
    }
    body.put("rule_id", context.ruleId());
    body.put("previous_status", context.previousStatus().name());
    body.put("new_status", newStatus.name());
    body.put("status_version", Long.toString(context.statusVersion()));
    if (context.triggerEventId() != null) {
      body.put("trigger_event_id", context.triggerEventId());
    }
    return body;
  }
}
