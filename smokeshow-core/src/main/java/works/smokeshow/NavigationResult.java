package works.smokeshow;

import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * What a {@link BrowserDriver} could tell us about a completed navigation.
 * Either part may be unavailable.
 */
@Value
@Accessors(fluent = true)
public class NavigationResult {
	@Nullable Integer status;
	@Nullable NavigationTiming timing;

	public static NavigationResult unknown() {
		return new NavigationResult(null, null);
	}
}
