package works.smokeshow.config;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

/**
 * Explicitly supplied configuration values. These take precedence over
 * environment variables, which in turn take precedence over defaults.
 * <p>
 * Every field is optional; null means "not specified".
 *
 * @see ConfigResolver
 */
@Value
@Builder
@Accessors(fluent = true)
public class SmokeshowSettings {
	@Nullable String serviceName;
	@Nullable String suiteName;
	@Nullable String baseUrl;
	@Nullable String otlpEndpoint;
	@Nullable String environment;
	@Nullable String trigger;
	@Nullable String browser;
	@Nullable Boolean headless;
	@Nullable Integer viewportWidth;
	@Nullable Integer viewportHeight;
	@Nullable ScreenshotPolicy screenshotPolicy;
	@Nullable String screenshotDirectory;

	public static SmokeshowSettings none() {
		return builder().build();
	}
}
