/**
 * Shipment tracking timeline engine.
 *
 * <p>{@link tracking.TrackingEngine} is the entry point: it ingests raw carrier payloads,
 * keeps each shipment's status equal to the fold of its ordered timeline, and triggers
 * automation rules once per status transition. Persistence is behind the SPIs in
 * {@code tracking.spi}; {@code tracking-jdbc} provides the relational implementation.
 */
package tracking;
