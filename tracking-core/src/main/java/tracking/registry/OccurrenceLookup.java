package tracking.registry;

import tracking.model.OccurrenceCode;

import java.util.Objects;

/**
 * Result of resolving an occurrence code against the registry.
 */
public sealed interface OccurrenceLookup permits OccurrenceLookup.Known, OccurrenceLookup.Unknown {

  /**
   * The code is part of the taxonomy.
   *
   * @param code the matching entry (carrier-specific or shared)
   */
  record Known(OccurrenceCode code) implements OccurrenceLookup {
    public Known {
      Objects.requireNonNull(code, "code");
    }
  }

  /**
   * The code is not in the taxonomy. Events carrying it are stored as unclassified.
   *
   * @param carrier the carrier the lookup was made for
   * @param code    the normalized code
   */
  record Unknown(String carrier, String code) implements OccurrenceLookup {}
}
