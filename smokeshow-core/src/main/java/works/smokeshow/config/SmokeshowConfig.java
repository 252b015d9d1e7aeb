package works.smokeshow.config;

import java.nio.file.Path;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * The fully resolved, immutable configuration for one suite run.
 * Produced by {@link ConfigResolver}.
 */
@Value
@Builder
@Accessors(fluent = true)
public class SmokeshowConfig {
	@NonNull String serviceName;
	@NonNull String suiteName;
	@NonNull String baseUrl;
	@NonNull String otlpEndpoint;
	@NonNull String environment;
	@NonNull String trigger;
	@NonNull String browser;
	boolean headless;
	int viewportWidth;
	int viewportHeight;
	@NonNull ScreenshotPolicy screenshotPolicy;
	@NonNull Path screenshotDirectory;
}
