/**
 * Spring Boot auto-configuration for the tracking engine.
 *
 * <p>{@link tracking.spring.boot.TrackingAutoConfiguration} wires a
 * {@link tracking.TrackingEngine} over the JDBC stores from {@code tracking.*} application
 * properties. Declare {@link tracking.model.AutomationRule} beans to register automation
 * rules, and a {@link tracking.spi.NotificationSender} bean to deliver notifications.
 *
 * @see tracking.spring.boot.TrackingAutoConfiguration
 * @see tracking.spring.boot.TrackingProperties
 * @see tracking.spring.boot.TrackingMicrometerAutoConfiguration
 */
package tracking.spring.boot;
