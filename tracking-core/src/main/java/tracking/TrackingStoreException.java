package tracking;

/**
 * Unchecked wrapper for storage failures ({@link java.sql.SQLException} and friends).
 *
 * <p>Loss of the store is the only condition the engine treats as fatal; this exception
 * propagates to the caller of {@link TrackingEngine#ingestRaw}.
 */
public class TrackingStoreException extends RuntimeException {

    public TrackingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
