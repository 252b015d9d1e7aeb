package works.smokeshow;

import io.opentelemetry.api.common.AttributeKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.config.SmokeshowConfig;
import works.smokeshow.spans.SpanRecorder;

import static io.opentelemetry.api.common.AttributeKey.booleanKey;
import static io.opentelemetry.api.common.AttributeKey.doubleKey;
import static io.opentelemetry.api.common.AttributeKey.longKey;
import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static io.opentelemetry.api.trace.StatusCode.ERROR;
import static io.opentelemetry.api.trace.StatusCode.OK;
import static works.smokeshow.config.ScreenshotPolicy.ON_FAILURE;
import static works.smokeshow.spans.SpanAttributes.CASE_DESCRIPTION;
import static works.smokeshow.spans.SpanAttributes.CASE_FAILURE_REASON;
import static works.smokeshow.spans.SpanAttributes.CASE_FAILURE_URL;
import static works.smokeshow.spans.SpanAttributes.CASE_ID;
import static works.smokeshow.spans.SpanAttributes.CASE_NAME;
import static works.smokeshow.spans.SpanAttributes.CASE_RESULT;
import static works.smokeshow.spans.SpanAttributes.CASE_RETRY_COUNT;
import static works.smokeshow.spans.SpanAttributes.CASE_SCREENSHOT_PATH;
import static works.smokeshow.spans.SpanAttributes.CASE_TAGS;

/**
 * One running test case, with its own span under the suite span.
 * Every action performed through this object gets a span under the test case's span.
 * <p>
 * Instances are created and finished by {@link SuiteRun#testCase}; once the test body
 * has returned or thrown, the test case is finished and accepts no more actions.
 */
public final class TestCase {
	private final SuiteRun suite;
	private final TestCaseInfo info;
	private final SpanRecorder recorder;
	private final BrowserDriver driver;
	private final String spanId;
	private final ActionController actions;
	private @Nullable TestOutcome outcome = null;

	TestCase(SuiteRun suite, TestCaseInfo info, SpanRecorder recorder, String suiteSpanId, BrowserDriver driver) {
		this.suite = suite;
		this.info = info;
		this.recorder = recorder;
		this.driver = driver;
		this.spanId = recorder.open(suiteSpanId, "test(\"" + info.name() + "\")");
		this.actions = new ActionController(recorder, spanId, driver);

		recorder.setAttribute(spanId, CASE_NAME, info.name());
		recorder.setAttribute(spanId, CASE_ID, blankToNull(info.caseId()));
		if (!info.tags().isEmpty()) {
			recorder.setAttribute(spanId, CASE_TAGS, String.join(",", info.tags()));
		}
		recorder.setAttribute(spanId, CASE_DESCRIPTION, blankToNull(info.description()));
		if (info.retryCount() != null) {
			recorder.setAttribute(spanId, CASE_RETRY_COUNT, info.retryCount().longValue());
		}
		LOGGER.debug("Test case \"{}\" started", info.label());
	}

	public TestCaseInfo info() {
		return info;
	}

	public String spanId() {
		return spanId;
	}

	/**
	 * @return null while the test case is still running
	 */
	public @Nullable TestOutcome outcome() {
		return outcome;
	}

	/**
	 * The raw driver, for operations that have no instrumented counterpart.
	 */
	public BrowserDriver driver() {
		return driver;
	}

	public NavigationResult navigate(String url) {
		return running().navigate(url);
	}

	public void click(String selector) {
		running().click(selector);
	}

	public void fill(String selector, String value) {
		fill(selector, value, false);
	}

	public void fill(String selector, String value, boolean sensitive) {
		running().fill(selector, value, sensitive);
	}

	public void assertVisible(String selector) {
		running().assertVisible(selector);
	}

	public String assertText(String selector, String expected) {
		return running().assertText(selector, expected);
	}

	public void assertCount(String selector, int expectedCount) {
		running().assertCount(selector, expectedCount);
	}

	public void assertUrl(String pattern) {
		running().assertUrl(pattern);
	}

	/**
	 * Runs a custom action in its own span.
	 */
	public <T> T action(String type, @Nullable String selector, ActionBody<T> body) {
		return running().run(type, selector, body);
	}

	public <T> TestCase setAttribute(AttributeKey<T> key, T value) {
		recorder.setAttribute(spanId, key, value);
		return this;
	}

	public TestCase setAttribute(String key, String value) {
		return setAttribute(stringKey(key), value);
	}

	public TestCase setAttribute(String key, long value) {
		return setAttribute(longKey(key), value);
	}

	public TestCase setAttribute(String key, double value) {
		return setAttribute(doubleKey(key), value);
	}

	public TestCase setAttribute(String key, boolean value) {
		return setAttribute(booleanKey(key), value);
	}

	private ActionController running() {
		if (outcome != null) {
			throw new IllegalStateException("Test case \"" + info.label() + "\" has already finished");
		}
		return actions;
	}

	/**
	 * Records the outcome, closes the span, and reports to the suite.
	 * Only the first call has any effect.
	 *
	 * @param failure what the test body threw, or null if it completed normally
	 */
	void finish(@Nullable Throwable failure) {
		if (outcome != null) {
			return;
		}
		outcome = (failure == null) ? TestOutcome.PASSED : TestOutcome.FAILED;
		try {
			if (!recorder.isOpen(spanId)) {
				LOGGER.warn("Test case \"{}\" span was closed before the test case finished; outcome {} not recorded on the span", info.label(), outcome.id());
			} else if (failure == null) {
				recorder.setAttribute(spanId, CASE_RESULT, outcome.id());
				recorder.setStatus(spanId, OK, null);
				recorder.close(spanId);
			} else {
				recordFailure(failure);
				recorder.close(spanId);
			}
		} finally {
			suite.report(this, outcome);
		}
	}

	private void recordFailure(Throwable failure) {
		Optional<String> scrubbed = actions.scrubbedDescription(failure);
		String reason = ActionController.failureMessage(scrubbed.orElseGet(() -> ActionController.describe(failure)));
		Optional<String> failureUrl = actions.currentUrl();
		recorder.setAttribute(spanId, CASE_RESULT, TestOutcome.FAILED.id());
		recorder.setAttribute(spanId, CASE_FAILURE_REASON, reason);
		failureUrl.ifPresent(url -> recorder.setAttribute(spanId, CASE_FAILURE_URL, url));
		recorder.setStatus(spanId, ERROR, reason);
		if (scrubbed.isEmpty()) {
			recorder.recordException(spanId, failure);
		}
		captureScreenshot().ifPresent(path -> recorder.setAttribute(spanId, CASE_SCREENSHOT_PATH, path.toString()));
		LOGGER.error("Test case FAILED: {} [{}] - {} (url={}, trace_id={}, span_id={})",
			info.label(),
			suite.config().suiteName(),
			reason,
			failureUrl.orElse("unknown"),
			recorder.traceId(spanId),
			spanId);
	}

	/**
	 * Best-effort: a screenshot failure is logged, and the test case's real failure stands.
	 */
	private Optional<Path> captureScreenshot() {
		SmokeshowConfig config = suite.config();
		if (config.screenshotPolicy() != ON_FAILURE) {
			return Optional.empty();
		}
		Path file = config.screenshotDirectory().resolve(fileNameFor(info.label()) + "-" + suite.runId() + ".png");
		try {
			byte[] png = driver.screenshot();
			Files.createDirectories(file.getParent());
			Files.write(file, png);
			return Optional.of(file);
		} catch (IOException | RuntimeException e) {
			LOGGER.warn("Unable to capture screenshot for test case \"{}\"", info.label(), e);
			return Optional.empty();
		}
	}

	static String fileNameFor(String label) {
		return label.replaceAll("[^A-Za-z0-9._-]", "_");
	}

	private static @Nullable String blankToNull(@Nullable String s) {
		return (s == null || s.isBlank()) ? null : s;
	}

	@Override
	public String toString() {
		return "TestCase(" + info.label() + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TestCase.class);
}
