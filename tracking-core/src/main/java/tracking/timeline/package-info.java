/**
 * Ordered, recomputed-on-demand shipment histories.
 *
 * @see tracking.timeline.TimelineBuilder
 * @see tracking.timeline.Timeline
 */
package tracking.timeline;
