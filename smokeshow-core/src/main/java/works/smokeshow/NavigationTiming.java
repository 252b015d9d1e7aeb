package works.smokeshow;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Milestones of a page load, in milliseconds from the start of navigation,
 * as reported by the browser's Navigation Timing API.
 */
@Value
@Accessors(fluent = true)
public class NavigationTiming {
	double domContentLoadedMs;
	double domInteractiveMs;
	double loadEventMs;
	long transferSizeBytes;
}
