/**
 * Service Provider Interfaces for plugging the engine into its surroundings.
 *
 * <p>Stores receive an explicit {@link java.sql.Connection} so the engine controls
 * transaction boundaries; the transition transaction spans
 * {@link tracking.spi.ShipmentStore#compareAndSetStatus} and
 * {@link tracking.spi.InvocationStore#claim}. Outbound side effects go through
 * {@link tracking.spi.NotificationSender}, {@link tracking.spi.WebhookClient} and
 * {@link tracking.spi.ArchiveStore}.
 *
 * @see tracking.spi.ConnectionProvider
 * @see tracking.spi.EventStore
 * @see tracking.spi.MetricsExporter
 */
package tracking.spi;
