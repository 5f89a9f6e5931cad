/**
 * Micrometer bridge for the engine's {@link tracking.spi.MetricsExporter} SPI.
 *
 * @see tracking.micrometer.MicrometerMetricsExporter
 */
package tracking.micrometer;
