package tracking.support;

import tracking.model.CanonicalStatus;
import tracking.model.Severity;
import tracking.model.Shipment;
import tracking.model.TrackingEvent;
import tracking.util.Ids;

import java.time.Instant;
import java.util.Map;

/**
 * Factories for canonical events and shipments used across tests.
 */
public final class TestEvents {
  public static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

  private TestEvents() {}

  public static Instant at(long minutes) {
    return T0.plusSeconds(minutes * 60);
  }

  public static TrackingEvent event(String shipmentId, CanonicalStatus status, Instant occurredAt,
      Instant receivedAt) {
    return event(Ids.newId(), shipmentId, status, occurredAt, receivedAt);
  }

  public static TrackingEvent event(String id, String shipmentId, CanonicalStatus status, Instant occurredAt,
      Instant receivedAt) {
    Severity severity = status.isTerminal() ? Severity.TERMINAL
        : status == CanonicalStatus.EXCEPTION ? Severity.EXCEPTION
        : status == CanonicalStatus.UNCLASSIFIED ? Severity.WARNING
        : Severity.INFO;
    String code = codeFor(status);
    return new TrackingEvent(id, shipmentId, code, status, severity, status.isTerminal(), "test", null,
        occurredAt, receivedAt, false, shipmentId + "|test|" + code + "|" + occurredAt + "|" + id, "{}",
        status == CanonicalStatus.UNCLASSIFIED);
  }

  public static Shipment shipment(String id, String trackingCode) {
    return shipment(id, trackingCode, Map.of());
  }

  public static Shipment shipment(String id, String trackingCode, Map<String, String> attributes) {
    return new Shipment(id, trackingCode, "acme", CanonicalStatus.CREATED, 0L, null, attributes, T0, T0);
  }

  private static String codeFor(CanonicalStatus status) {
    switch (status) {
      case COLLECTED:
        return "80";
      case IN_TRANSIT:
        return "17";
      case OUT_FOR_DELIVERY:
        return "85";
      case DELIVERED:
        return "1";
      case RETURNED:
        return "3";
      case EXCEPTION:
        return "5";
      default:
        return "999";
    }
  }
}
