package tracking.normalize;

/**
 * Reads one carrier integration's payload format.
 *
 * <p>A missing or unparseable timestamp is not an error: return {@code null} for
 * {@link ExtractedFields#occurredAt()} and the normalizer falls back to the receipt time.
 * A payload without an occurrence code, or one that is not parseable at all, is.
 *
 * @see FlatJsonPayloadExtractor
 * @see SswPayloadExtractor
 */
@FunctionalInterface
public interface PayloadExtractor {

    /**
     * @param rawPayload payload exactly as received, never {@code null}
     * @return extracted fields
     * @throws MalformedPayloadException if the payload cannot be interpreted
     */
    ExtractedFields extract(String rawPayload);
}
