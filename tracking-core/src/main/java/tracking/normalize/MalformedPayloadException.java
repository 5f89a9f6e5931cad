package tracking.normalize;

/**
 * Thrown by a {@link PayloadExtractor} when a payload cannot be interpreted at all.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
