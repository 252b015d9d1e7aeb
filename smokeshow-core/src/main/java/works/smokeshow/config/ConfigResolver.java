package works.smokeshow.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges {@link SmokeshowSettings} over environment variables over defaults.
 * <p>
 * For each option, the explicit setting wins if it is non-null (and, for strings, non-blank);
 * otherwise the environment variable wins if it is set and non-blank;
 * otherwise the default applies.
 * An environment value that can't be parsed is logged and ignored in favour of the default.
 * <p>
 * Resolution reads the environment and nothing else.
 */
public final class ConfigResolver {
	private ConfigResolver() {}

	public static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";
	public static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
	public static final String ENV_ENVIRONMENT = "PLAYWRIGHT_OTEL_ENVIRONMENT";
	public static final String ENV_TRIGGER = "PLAYWRIGHT_OTEL_TRIGGER";
	public static final String ENV_BROWSER = "PLAYWRIGHT_OTEL_BROWSER";
	public static final String ENV_HEADLESS = "PLAYWRIGHT_OTEL_HEADLESS";
	public static final String ENV_VIEWPORT_WIDTH = "PLAYWRIGHT_OTEL_VIEWPORT_WIDTH";
	public static final String ENV_VIEWPORT_HEIGHT = "PLAYWRIGHT_OTEL_VIEWPORT_HEIGHT";
	public static final String ENV_SCREENSHOTS = "PLAYWRIGHT_OTEL_SCREENSHOTS";
	public static final String ENV_SCREENSHOT_DIR = "PLAYWRIGHT_OTEL_SCREENSHOT_DIR";

	public static final String DEFAULT_SERVICE_NAME = "playwright-otel";
	public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";
	public static final String DEFAULT_ENVIRONMENT = "development";
	public static final String DEFAULT_TRIGGER = "manual";
	public static final String DEFAULT_BROWSER = "chromium";
	public static final boolean DEFAULT_HEADLESS = true;
	public static final int DEFAULT_VIEWPORT_WIDTH = 1280;
	public static final int DEFAULT_VIEWPORT_HEIGHT = 720;
	public static final ScreenshotPolicy DEFAULT_SCREENSHOT_POLICY = ScreenshotPolicy.NEVER;
	public static final String DEFAULT_SCREENSHOT_DIR = "screenshots";

	public static SmokeshowConfig resolve(@NonNull SmokeshowSettings explicit) {
		return resolve(explicit, System.getenv());
	}

	public static SmokeshowConfig resolve(@NonNull SmokeshowSettings explicit, @NonNull Map<String, String> environment) {
		Sources sources = new Sources(environment);
		return SmokeshowConfig.builder()
			.serviceName(sources.string(explicit.serviceName(), ENV_SERVICE_NAME, DEFAULT_SERVICE_NAME))
			.suiteName(sources.string(explicit.suiteName(), null, ""))
			.baseUrl(sources.string(explicit.baseUrl(), null, ""))
			.otlpEndpoint(sources.string(explicit.otlpEndpoint(), ENV_OTLP_ENDPOINT, DEFAULT_OTLP_ENDPOINT))
			.environment(sources.string(explicit.environment(), ENV_ENVIRONMENT, DEFAULT_ENVIRONMENT))
			.trigger(sources.string(explicit.trigger(), ENV_TRIGGER, DEFAULT_TRIGGER))
			.browser(sources.string(explicit.browser(), ENV_BROWSER, DEFAULT_BROWSER))
			.headless(sources.parsed(explicit.headless(), ENV_HEADLESS, ConfigResolver::parseBoolean, DEFAULT_HEADLESS))
			.viewportWidth(sources.parsed(explicit.viewportWidth(), ENV_VIEWPORT_WIDTH, ConfigResolver::parsePositiveInt, DEFAULT_VIEWPORT_WIDTH))
			.viewportHeight(sources.parsed(explicit.viewportHeight(), ENV_VIEWPORT_HEIGHT, ConfigResolver::parsePositiveInt, DEFAULT_VIEWPORT_HEIGHT))
			.screenshotPolicy(sources.parsed(explicit.screenshotPolicy(), ENV_SCREENSHOTS, ScreenshotPolicy::parse, DEFAULT_SCREENSHOT_POLICY))
			.screenshotDirectory(Path.of(sources.string(explicit.screenshotDirectory(), ENV_SCREENSHOT_DIR, DEFAULT_SCREENSHOT_DIR)))
			.build();
	}

	@RequiredArgsConstructor
	private static final class Sources {
		final Map<String, String> environment;

		String string(@Nullable String explicit, @Nullable String envVar, String defaultValue) {
			if (!isBlank(explicit)) {
				return explicit;
			}
			String fromEnv = envValue(envVar);
			return fromEnv == null ? defaultValue : fromEnv;
		}

		/**
		 * @param parser returns null if its argument is malformed
		 */
		<T> T parsed(@Nullable T explicit, String envVar, Function<String, T> parser, T defaultValue) {
			if (explicit != null) {
				return explicit;
			}
			String fromEnv = envValue(envVar);
			if (fromEnv == null) {
				return defaultValue;
			}
			T result = parser.apply(fromEnv);
			if (result == null) {
				LOGGER.warn("Ignoring malformed value \"{}\" for {}; using default {}", fromEnv, envVar, defaultValue);
				return defaultValue;
			}
			return result;
		}

		private @Nullable String envValue(@Nullable String envVar) {
			if (envVar == null) {
				return null;
			}
			String value = environment.get(envVar);
			return isBlank(value) ? null : value.trim();
		}
	}

	static @Nullable Boolean parseBoolean(String text) {
		switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "true": case "1": case "yes":
				return true;
			case "false": case "0": case "no":
				return false;
			default:
				return null;
		}
	}

	static @Nullable Integer parsePositiveInt(String text) {
		try {
			int result = Integer.parseInt(text.trim());
			return result > 0 ? result : null;
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static boolean isBlank(@Nullable String s) {
		return s == null || s.isBlank();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigResolver.class);
}
