package tracking.ingest;

/**
 * Result of storing a normalized event.
 */
public enum IngestResult {
  /** First time this dedup key was seen; downstream work follows. */
  ACCEPTED,
  /** The dedup key was already stored; nothing else happens. */
  DUPLICATE
}
