package tracking.normalize;

import tracking.util.JsonCodec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extractor for SSW-family carriers, which report occurrences with Portuguese field names
 * and Brazilian local timestamps:
 *
 * <pre>{@code
 * {"nro_nf": "123456", "codigo": "85", "data_hora": "20/11/2025 14:30",
 *  "descricao": "saida para entrega", "id": "9981"}
 * }</pre>
 *
 * <p>Timestamps use {@code dd/MM/yyyy HH:mm} or {@code dd/MM/yy HH:mm}, either in one
 * {@code data_hora} field or split across {@code data} and {@code hora}, and are read in
 * {@code America/Sao_Paulo} unless configured otherwise.
 */
public final class SswPayloadExtractor implements PayloadExtractor {
  public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Sao_Paulo");

  private static final List<String> CODE_KEYS = List.of("codigo", "ocorrencia", "cod_ocorrencia");
  private static final List<String> TRACKING_KEYS = List.of("tracking", "nro_nf", "chave");
  private static final List<String> ID_KEYS = List.of("id", "id_ocorrencia");
  private static final DateTimeFormatter FULL_YEAR = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");
  private static final DateTimeFormatter SHORT_YEAR = DateTimeFormatter.ofPattern("dd/MM/yy HH:mm");

  private final JsonCodec jsonCodec;
  private final ZoneId zone;

  public SswPayloadExtractor() {
    this(JsonCodec.getDefault(), DEFAULT_ZONE);
  }

  public SswPayloadExtractor(JsonCodec jsonCodec, ZoneId zone) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  @Override
  public ExtractedFields extract(String rawPayload) {
    Map<String, String> fields;
    try {
      fields = jsonCodec.parseObject(rawPayload);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException("SSW payload is not a flat JSON object: " + e.getMessage(), e);
    }
    String code = first(fields, CODE_KEYS);
    if (code == null) {
      throw new MalformedPayloadException("SSW payload has no occurrence code " + CODE_KEYS);
    }
    return new ExtractedFields(first(fields, TRACKING_KEYS), code, occurredAt(fields), first(fields, ID_KEYS));
  }

  private Instant occurredAt(Map<String, String> fields) {
    String text = FlatJsonPayloadExtractor.blankToNull(fields.get("data_hora"));
    if (text == null) {
      String date = FlatJsonPayloadExtractor.blankToNull(fields.get("data"));
      String time = FlatJsonPayloadExtractor.blankToNull(fields.get("hora"));
      if (date == null || time == null) {
        return null;
      }
      text = date + " " + time;
    }
    LocalDateTime local = parseLocal(text);
    return local == null ? null : local.atZone(zone).toInstant();
  }

  static LocalDateTime parseLocal(String text) {
    String[] parts = text.trim().split("\\s+");
    if (parts.length != 2) {
      return null;
    }
    DateTimeFormatter formatter = parts[0].length() == 8 ? SHORT_YEAR : FULL_YEAR;
    try {
      return LocalDateTime.parse(parts[0] + " " + parts[1], formatter);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String first(Map<String, String> fields, List<String> keys) {
    for (String key : keys) {
      String value = FlatJsonPayloadExtractor.blankToNull(fields.get(key));
      if (value != null) {
        return value;
      }
    }
    return null;
  }
}
