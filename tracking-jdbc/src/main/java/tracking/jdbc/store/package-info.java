/**
 * JDBC implementations of the engine's store SPIs, parameterized by a
 * {@link tracking.jdbc.spi.Dialect}.
 *
 * @see tracking.jdbc.store.JdbcTrackingStores
 */
package tracking.jdbc.store;
