package works.smokeshow.config;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * When to capture a browser screenshot for a test case.
 */
public enum ScreenshotPolicy {
	NEVER,

	/**
	 * Capture when a test case fails, and record the file path on its span.
	 */
	ON_FAILURE;

	/**
	 * @return the policy named by <code>text</code> (e.g. <code>on_failure</code>), or null if there is none
	 */
	static @Nullable ScreenshotPolicy parse(String text) {
		String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		for (ScreenshotPolicy policy: values()) {
			if (policy.name().equals(normalized)) {
				return policy;
			}
		}
		return null;
	}
}
