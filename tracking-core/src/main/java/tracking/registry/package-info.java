/**
 * Occurrence code taxonomy: carrier codes mapped to canonical statuses, with atomic reload.
 *
 * @see tracking.registry.OccurrenceCodeRegistry
 * @see tracking.registry.OccurrenceCodeSource
 */
package tracking.registry;
