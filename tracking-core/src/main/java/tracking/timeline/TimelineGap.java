package tracking.timeline;

import java.time.Duration;

/**
 * Two consecutive timeline entries further apart than the gap threshold.
 */
public record TimelineGap(TimelineEntry from, TimelineEntry to, Duration duration) {}
