package tracking.normalize;

import tracking.model.CanonicalStatus;
import tracking.model.OccurrenceCode;
import tracking.model.Severity;
import tracking.model.Shipment;
import tracking.model.TrackingEvent;
import tracking.registry.OccurrenceCodeRegistry;
import tracking.registry.OccurrenceLookup;
import tracking.util.Ids;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns raw carrier payloads into canonical {@link TrackingEvent}s.
 *
 * <p>Steps: pick the {@link PayloadExtractor} registered for the source, resolve the shipment
 * (explicit hint first, then the payload's tracking code), classify the occurrence code for
 * the shipment's carrier, fall back to the receipt time when the payload carries no usable
 * timestamp, and derive the dedup key.
 *
 * <p>Unknown codes are not a rejection: the event is kept as
 * {@link CanonicalStatus#UNCLASSIFIED} and flagged for review.
 *
 * <p>Create instances via {@link #builder()}. This class is stateless and thread-safe.
 */
public final class EventNormalizer {
  private static final Logger logger = Logger.getLogger(EventNormalizer.class.getName());

  private final OccurrenceCodeRegistry registry;
  private final ShipmentResolver shipmentResolver;
  private final Map<String, PayloadExtractor> extractors;
  private final PayloadExtractor defaultExtractor;

  private EventNormalizer(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.shipmentResolver = Objects.requireNonNull(builder.shipmentResolver, "shipmentResolver");
    this.extractors = Map.copyOf(builder.extractors);
    this.defaultExtractor = builder.defaultExtractor != null
        ? builder.defaultExtractor : new FlatJsonPayloadExtractor();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Normalizes one payload.
   *
   * @param rawPayload   payload exactly as received
   * @param source       carrier integration identifier
   * @param shipmentHint explicit shipment reference (tracking code or id), may be {@code null}
   * @param receivedAt   receipt time
   * @return {@link NormalizedEvent.Canonical} or {@link NormalizedEvent.Rejected}; never throws
   *     for bad carrier data
   */
  public NormalizedEvent normalize(String rawPayload, String source, String shipmentHint, Instant receivedAt) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(receivedAt, "receivedAt");
    String hint = FlatJsonPayloadExtractor.blankToNull(shipmentHint);

    if (rawPayload == null || rawPayload.isBlank()) {
      return new NormalizedEvent.Rejected(RejectionReason.MALFORMED_PAYLOAD, "Empty payload", hint);
    }

    ExtractedFields fields;
    try {
      fields = extractorFor(source).extract(rawPayload);
    } catch (MalformedPayloadException e) {
      logger.log(Level.FINE, "Malformed payload from source={0}: {1}",
          new Object[] {source, e.getMessage()});
      return new NormalizedEvent.Rejected(RejectionReason.MALFORMED_PAYLOAD, e.getMessage(), hint);
    }

    String reference = hint != null ? hint : fields.trackingCode();
    if (reference == null) {
      return new NormalizedEvent.Rejected(RejectionReason.UNRESOLVED_SHIPMENT,
          "Payload carries no shipment reference", null);
    }
    Optional<Shipment> resolved = shipmentResolver.resolve(reference);
    if (resolved.isEmpty()) {
      return new NormalizedEvent.Rejected(RejectionReason.UNRESOLVED_SHIPMENT,
          "No shipment for reference " + reference, reference);
    }
    Shipment shipment = resolved.get();
    return new NormalizedEvent.Canonical(toEvent(fields, shipment, source, rawPayload, receivedAt), shipment);
  }

  private TrackingEvent toEvent(ExtractedFields fields, Shipment shipment, String source,
      String rawPayload, Instant receivedAt) {
    OccurrenceLookup lookup = registry.lookup(shipment.carrier(), fields.occurrenceCode());
    String code;
    CanonicalStatus status;
    Severity severity;
    boolean terminal;
    boolean needsReview;
    if (lookup instanceof OccurrenceLookup.Known known) {
      OccurrenceCode occurrence = known.code();
      code = occurrence.code();
      status = occurrence.canonicalStatus();
      severity = occurrence.severity();
      terminal = occurrence.terminal();
      needsReview = false;
    } else {
      code = OccurrenceCode.normalizeCode(fields.occurrenceCode());
      status = CanonicalStatus.UNCLASSIFIED;
      severity = Severity.WARNING;
      terminal = false;
      needsReview = true;
    }

    boolean estimated = fields.occurredAt() == null;
    Instant occurredAt = estimated ? receivedAt : fields.occurredAt();

    String dedupKey;
    if (fields.carrierEventId() != null) {
      dedupKey = DedupKeys.external(source, fields.carrierEventId());
    } else if (estimated) {
      dedupKey = DedupKeys.derivedFromPayload(shipment.id(), source, code, rawPayload);
    } else {
      dedupKey = DedupKeys.derived(shipment.id(), source, code, occurredAt);
    }

    return new TrackingEvent(Ids.newId(), shipment.id(), code, status, severity, terminal, source,
        fields.carrierEventId(), occurredAt, receivedAt, estimated, dedupKey, rawPayload, needsReview);
  }

  private PayloadExtractor extractorFor(String source) {
    PayloadExtractor extractor = extractors.get(source);
    return extractor != null ? extractor : defaultExtractor;
  }

  /** Builder for {@link EventNormalizer}. */
  public static final class Builder {
    private OccurrenceCodeRegistry registry;
    private ShipmentResolver shipmentResolver;
    private final Map<String, PayloadExtractor> extractors = new HashMap<>();
    private PayloadExtractor defaultExtractor;

    private Builder() {}

    /**
     * Sets the occurrence code registry used for classification.
     *
     * <p><b>Required.</b>
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(OccurrenceCodeRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the resolver that finds shipments by tracking code or id.
     *
     * <p><b>Required.</b>
     *
     * @param shipmentResolver the resolver
     * @return this builder
     */
    public Builder shipmentResolver(ShipmentResolver shipmentResolver) {
      this.shipmentResolver = shipmentResolver;
      return this;
    }

    /**
     * Registers the extractor for one source.
     *
     * @param source    carrier integration identifier
     * @param extractor the extractor
     * @return this builder
     */
    public Builder extractor(String source, PayloadExtractor extractor) {
      this.extractors.put(Objects.requireNonNull(source, "source"),
          Objects.requireNonNull(extractor, "extractor"));
      return this;
    }

    public Builder extractors(Map<String, PayloadExtractor> extractors) {
      extractors.forEach(this::extractor);
      return this;
    }

    /**
     * Sets the extractor used for sources without a registered one.
     *
     * <p>Optional. Defaults to {@link FlatJsonPayloadExtractor}.
     *
     * @param defaultExtractor the fallback extractor
     * @return this builder
     */
    public Builder defaultExtractor(PayloadExtractor defaultExtractor) {
      this.defaultExtractor = defaultExtractor;
      return this;
    }

    public EventNormalizer build() {
      return new EventNormalizer(this);
    }
  }
}
