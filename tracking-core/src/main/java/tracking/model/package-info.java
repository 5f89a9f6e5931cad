/**
 * Domain records and enums shared by every engine component.
 *
 * <p>Cross-entity references are ids only: a {@link tracking.model.TrackingEvent} knows its
 * shipment id, an {@link tracking.model.AutomationInvocation} knows its shipment, rule and
 * trigger event ids.
 */
package tracking.model;
