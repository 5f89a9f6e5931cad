package tracking.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Deduplication key derivation.
 *
 * <ul>
 *   <li>{@code ext:<source>:<carrierEventId>} when the carrier supplies an event id;</li>
 *   <li>otherwise {@code sha256:} over shipment, source, code and occurrence time;</li>
 *   <li>for an estimated occurrence time, the receipt time is unstable across redeliveries,
 *       so the digest of the raw payload takes its place.</li>
 * </ul>
 */
public final class DedupKeys {
  private static final char SEPARATOR = '|';

  private DedupKeys() {}

  public static String external(String source, String carrierEventId) {
    return "ext:" + source + ":" + carrierEventId;
  }

  public static String derived(String shipmentId, String source, String code, Instant occurredAt) {
    return "sha256:" + sha256Hex(shipmentId + SEPARATOR + source + SEPARATOR + code
        + SEPARATOR + occurredAt);
  }

  public static String derivedFromPayload(String shipmentId, String source, String code, String rawPayload) {
    return "sha256:" + sha256Hex(shipmentId + SEPARATOR + source + SEPARATOR + code
        + SEPARATOR + "raw:" + sha256Hex(rawPayload));
  }

  public static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
