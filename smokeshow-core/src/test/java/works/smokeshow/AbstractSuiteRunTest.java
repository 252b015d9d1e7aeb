package works.smokeshow;

import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import works.smokeshow.config.SmokeshowSettings;
import works.smokeshow.spans.RecordingSpanExporter;
import works.smokeshow.vcs.VcsMetadata;

/**
 * Opens suite runs against a {@link FakeBrowserDriver}, with an empty environment,
 * exporting to a {@link RecordingSpanExporter}.
 */
abstract class AbstractSuiteRunTest {
	static final VcsMetadata VCS = new VcsMetadata("3f9c2d1e8b7a6f5e4d3c2b1a0f9e8d7c6b5a4f3e", "main");
	static final String SUITE_LABEL = "Checkout smoke";

	RecordingSpanExporter exporter;
	FakeBrowserDriver driver;

	@BeforeEach
	void setupSuiteRun() {
		exporter = new RecordingSpanExporter();
		driver = new FakeBrowserDriver()
			.withElement("h1", "Example Domain")
			.withElement("input#email", "")
			.withElement("input#password", "")
			.withElement("button[type=submit]", "Sign in");
	}

	SmokeshowSettings.SmokeshowSettingsBuilder settings() {
		return SmokeshowSettings.builder()
			.suiteName(SUITE_LABEL)
			.baseUrl("https://example.com");
	}

	SuiteRun openSuite() {
		return openSuite(settings().build());
	}

	SuiteRun openSuite(SmokeshowSettings settings) {
		return openSuite(settings, Map.of());
	}

	SuiteRun openSuite(SmokeshowSettings settings, Map<String, String> environment) {
		return SuiteRun.builder()
			.driver(driver)
			.settings(settings)
			.environment(environment)
			.exporterFactory(config -> exporter)
			.vcs(() -> VCS)
			.open();
	}

	SpanData suiteSpan() {
		return exporter.span("suite(\"" + SUITE_LABEL + "\")");
	}

	SpanData testSpan(String name) {
		return exporter.span("test(\"" + name + "\")");
	}
}
