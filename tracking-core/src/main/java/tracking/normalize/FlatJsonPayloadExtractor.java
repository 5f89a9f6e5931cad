package tracking.normalize;

import tracking.util.JsonCodec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Default extractor for integrations that push a flat JSON object:
 *
 * <pre>{@code
 * {"tracking_code": "BR123", "occurrence_code": "85",
 *  "occurred_at": "2025-11-20T14:30:00-03:00", "event_id": "evt-991"}
 * }</pre>
 *
 * <p>{@code occurred_at} is ISO-8601; a value without offset is read in the configured zone.
 */
public final class FlatJsonPayloadExtractor implements PayloadExtractor {
  public static final String TRACKING_CODE = "tracking_code";
  public static final String OCCURRENCE_CODE = "occurrence_code";
  public static final String OCCURRED_AT = "occurred_at";
  public static final String EVENT_ID = "event_id";

  private final JsonCodec jsonCodec;
  private final ZoneId zone;

  public FlatJsonPayloadExtractor() {
    this(JsonCodec.getDefault(), ZoneOffset.UTC);
  }

  public FlatJsonPayloadExtractor(JsonCodec jsonCodec, ZoneId zone) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public ExtractedFields extract(String rawPayload) {
    Map<String, String> fields;
    try {
      fields = jsonCodec.parseObject(rawPayload);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("Payload is not a flat JSON object: " + e.getMessage(), e);
    }
    String code = blankToNull(fields.get(OCCURRENCE_CODE));
    if (code == null) {
      throw new MalformedPayloadException("Missing " + OCCURRENCE_CODE);
    }
    return new ExtractedFields(
        blankToNull(fields.get(TRACKING_CODE)),
        code,
        parseTimestamp(fields.get(OCCURRED_AT)),
        blankToNull(fields.get(EVENT_ID)));
  }

  private Instant parseTimestamp(String value) {
    String text = blankToNull(value);
    if (text == null) {
      return null;
    }
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException ignored) {
      // fall through to the zone-less form
    }
    try {
      return LocalDateTime.parse(text).atZone(zone).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
