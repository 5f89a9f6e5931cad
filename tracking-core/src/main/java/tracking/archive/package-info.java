/**
 * Best-effort archival of raw events and timeline snapshots. Nothing here is read back for
 * status derivation.
 */
package tracking.archive;
