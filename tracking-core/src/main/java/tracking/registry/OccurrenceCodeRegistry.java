package tracking.registry;

import tracking.model.OccurrenceCode;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory taxonomy of occurrence codes with atomic reload.
 *
 * <p>Lookups read an immutable {@link Snapshot}; {@link #reload()} builds a complete new
 * snapshot off to the side and publishes it with a single reference swap, so a lookup never
 * observes a half-loaded taxonomy. A failed or invalid reload keeps the previous snapshot.
 *
 * <p>Carrier-specific entries win over the shared ({@code "*"}) taxonomy.
 *
 * <p>This class is thread-safe.
 */
public final class OccurrenceCodeRegistry {
  private static final Logger logger = Logger.getLogger(OccurrenceCodeRegistry.class.getName());

  private final OccurrenceCodeSource source;
  private final AtomicReference<Snapshot> current = new AtomicReference<>();

  /**
   * Creates the registry and performs the initial load.
   *
   * @param source taxonomy source
   * @throws IllegalStateException if the initial load fails or is invalid
   */
  public OccurrenceCodeRegistry(OccurrenceCodeSource source) {
    this.source = Objects.requireNonNull(source, "source");
    try {
      current.set(Snapshot.of(source.load()));
    } catch (Exception e) {
      throw new IllegalStateException("Failed to load occurrence codes", e);
    }
    logger.log(Level.INFO, "Loaded {0} occurrence codes", current.get().size());
  }

  /**
   * Looks up a code in the shared taxonomy.
   *
   * @param code the raw code
   * @return {@link OccurrenceLookup.Known} or {@link OccurrenceLookup.Unknown}
   */
  public OccurrenceLookup lookup(String code) {
    return lookup(OccurrenceCode.WILDCARD_CARRIER, code);
  }

  /**
   * Looks up a code for a carrier, falling back to the shared taxonomy.
   *
   * @param carrier carrier identifier ({@code null} means shared only)
   * @param code    the raw code
   * @return {@link OccurrenceLookup.Known} or {@link OccurrenceLookup.Unknown}
   */
  public OccurrenceLookup lookup(String carrier, String code) {
    String normalized = OccurrenceCode.normalizeCode(code);
    Snapshot snapshot = current.get();
    OccurrenceCode match = null;
    if (carrier != null && !OccurrenceCode.WILDCARD_CARRIER.equals(carrier)) {
      match = snapshot.get(carrier, normalized);
    }
    if (match == null) {
      match = snapshot.get(OccurrenceCode.WILDCARD_CARRIER, normalized);
    }
    return match != null
        ? new OccurrenceLookup.Known(match)
        : new OccurrenceLookup.Unknown(carrier, normalized);
  }

  /**
   * Reloads the taxonomy from the source and publishes it atomically.
   *
   * @return {@code true} if the new taxonomy is now active, {@code false} if the reload
   *     failed and the previous taxonomy remains in effect
   */
  public boolean reload() {
    Snapshot next;
    try {
      next = Snapshot.of(source.load());
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Occurrence code reload failed; keeping "
          + current.get().size() + " previously loaded codes", e);
      return false;
    }
    Snapshot previous = current.getAndSet(next);
    logger.log(Level.INFO, "Reloaded occurrence codes: {0} -> {1}",
        new Object[] {previous.size(), next.size()});
    return true;
  }

  public Snapshot snapshot() {
    return current.get();
  }

  public int size() {
    return current.get().size();
  }

  public Collection<OccurrenceCode> all() {
    return current.get().codes();
  }

  /**
   * Immutable, validated view of the taxonomy at one point in time.
   */
  public static final class Snapshot {
    private final Map<String, OccurrenceCode> byKey;
    private final List<OccurrenceCode> codes;
    private final Instant loadedAt;

    private Snapshot(Map<String, OccurrenceCode> byKey, List<OccurrenceCode> codes) {
      this.byKey = byKey;
      this.codes = codes;
      this.loadedAt = Instant.now();
    }

    static Snapshot of(List<OccurrenceCode> codes) {
      Objects.requireNonNull(codes, "codes");
      if (codes.isEmpty()) {
        throw new IllegalArgumentException("Occurrence code source returned no codes");
      }
      Map<String, OccurrenceCode> byKey = new HashMap<>(codes.size() * 2);
      for (OccurrenceCode code : codes) {
        OccurrenceCode previous = byKey.putIfAbsent(key(code.carrier(), code.code()), code);
        if (previous != null) {
          throw new IllegalArgumentException("Duplicate occurrence code " + code.code()
              + " for carrier " + code.carrier());
        }
      }
      return new Snapshot(Map.copyOf(byKey), List.copyOf(codes));
    }

    OccurrenceCode get(String carrier, String code) {
      return byKey.get(key(carrier, code));
    }

    public List<OccurrenceCode> codes() {
      return codes;
    }

    public int size() {
      return codes.size();
    }

    public Instant loadedAt() {
      return loadedAt;
    }

    private static String key(String carrier, String code) {
      return carrier + '\u0000' + code;
    }
  }
}
