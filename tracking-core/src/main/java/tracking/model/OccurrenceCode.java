package tracking.model;

import java.util.Objects;

/**
 * One entry of the occurrence code taxonomy: a carrier-specific code and the canonical
 * status it maps to.
 *
 * <p>The carrier {@link #WILDCARD_CARRIER} marks the shared taxonomy (the SSW code set),
 * which applies to every carrier that has no specific entry for a code.
 *
 * @param carrier         carrier identifier, or {@code "*"} for the shared taxonomy
 * @param code            the carrier's occurrence code, normalized by {@link #normalizeCode}
 * @param description     human readable description
 * @param type            descriptive grouping from the carrier table (e.g. "entrega", "pendência")
 * @param process         lifecycle phase from the carrier table (e.g. "transporte", "finalizadora")
 * @param canonicalStatus the single canonical status this code maps to
 * @param severity        operational severity; {@link Severity#TERMINAL} iff the status is terminal
 */
public record OccurrenceCode(
    String carrier,
    String code,
    String description,
    String type,
    String process,
    CanonicalStatus canonicalStatus,
    Severity severity
) {

  public static final String WILDCARD_CARRIER = "*";

  public OccurrenceCode {
    Objects.requireNonNull(carrier, "carrier");
    Objects.requireNonNull(canonicalStatus, "canonicalStatus");
    Objects.requireNonNull(severity, "severity");
    code = normalizeCode(code);
    if (code.isEmpty()) {
      throw new IllegalArgumentException("code must not be empty");
    }
    if (canonicalStatus == CanonicalStatus.UNCLASSIFIED) {
      throw new IllegalArgumentException("code " + code + " cannot map to UNCLASSIFIED");
    }
    if ((severity == Severity.TERMINAL) != canonicalStatus.isTerminal()) {
      throw new IllegalArgumentException("code " + code + ": severity " + severity
          + " is inconsistent with status " + canonicalStatus);
    }
    description = description == null ? "" : description;
  }

  /**
   * Returns whether this code closes the shipment.
   *
   * @return {@code true} if severity is {@link Severity#TERMINAL}
   */
  public boolean terminal() {
    return severity == Severity.TERMINAL;
  }

  /**
   * Canonical textual form of an occurrence code: trimmed, and stripped of leading zeros
   * when purely numeric ({@code "01"} and {@code "1"} are the same SSW code).
   *
   * @param raw the code as received
   * @return the normalized code, never {@code null}
   */
  public static String normalizeCode(String raw) {
    if (raw == null) {
      return "";
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
      return trimmed;
    }
    int i = 0;
    while (i < trimmed.length() - 1 && trimmed.charAt(i) == '0') {
      i++;
    }
    return trimmed.substring(i);
  }
}
