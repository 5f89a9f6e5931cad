package tracking.util;

import java.util.Map;

/**
 * Codec for flat JSON objects: carrier payloads, shipment attributes and archive documents.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and only
 * understands a single level of keys. Scalar values (strings, numbers, booleans) are all
 * surfaced as strings, which is how carrier integrations tend to disagree about
 * {@code "occurrence_code": 1} versus {@code "occurrence_code": "01"}.
 * Integrators with Jackson or Gson on the classpath can implement this interface instead.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object string. Returns {@code null} if the map is null or empty.
     *
     * @param values the values to encode
     * @return JSON string, or {@code null}
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a flat JSON object into a string map. Returns an empty map for {@code null},
     * empty, or {@code "null"} input. Members whose value is {@code null} are omitted.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null}), in document order
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
