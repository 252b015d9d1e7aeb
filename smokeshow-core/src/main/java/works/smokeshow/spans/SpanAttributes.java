package works.smokeshow.spans;

import io.opentelemetry.api.common.AttributeKey;

import static io.opentelemetry.api.common.AttributeKey.booleanKey;
import static io.opentelemetry.api.common.AttributeKey.doubleKey;
import static io.opentelemetry.api.common.AttributeKey.longKey;
import static io.opentelemetry.api.common.AttributeKey.stringKey;

/**
 * Attribute keys recorded on suite, test-case, and action spans.
 * Trace backends query these by name, so the key strings must not change.
 */
public final class SpanAttributes {
	private SpanAttributes() {}

	public static final AttributeKey<String> SUITE_NAME = stringKey("test.suite.name");
	public static final AttributeKey<String> SUITE_ID = stringKey("test.suite.id");
	public static final AttributeKey<Long> SUITE_TOTAL_TESTS = longKey("test.suite.total_tests");
	public static final AttributeKey<Long> SUITE_PASSED = longKey("test.suite.passed");
	public static final AttributeKey<Long> SUITE_FAILED = longKey("test.suite.failed");
	public static final AttributeKey<String> SUITE_RESULT = stringKey("test.suite.result");

	public static final AttributeKey<String> RUN_TRIGGER = stringKey("test.run.trigger");
	public static final AttributeKey<String> RUN_TIMESTAMP = stringKey("test.run.timestamp");

	public static final AttributeKey<String> TARGET_BASE_URL = stringKey("test.target.base_url");
	public static final AttributeKey<String> TARGET_ENVIRONMENT = stringKey("test.target.environment");

	public static final AttributeKey<String> BROWSER_NAME = stringKey("test.browser.name");
	public static final AttributeKey<Boolean> BROWSER_HEADLESS = booleanKey("test.browser.headless");

	public static final AttributeKey<Long> VIEWPORT_WIDTH = longKey("test.viewport.width");
	public static final AttributeKey<Long> VIEWPORT_HEIGHT = longKey("test.viewport.height");

	public static final AttributeKey<String> VCS_COMMIT_SHA = stringKey("vcs.commit.sha");
	public static final AttributeKey<String> VCS_BRANCH = stringKey("vcs.branch");

	public static final AttributeKey<String> CASE_NAME = stringKey("test.case.name");
	public static final AttributeKey<String> CASE_ID = stringKey("test.case.id");
	public static final AttributeKey<String> CASE_TAGS = stringKey("test.case.tags");
	public static final AttributeKey<String> CASE_DESCRIPTION = stringKey("test.case.description");
	public static final AttributeKey<Long> CASE_RETRY_COUNT = longKey("test.case.retry_count");
	public static final AttributeKey<String> CASE_RESULT = stringKey("test.case.result");
	public static final AttributeKey<String> CASE_FAILURE_REASON = stringKey("test.case.failure_reason");
	public static final AttributeKey<String> CASE_FAILURE_URL = stringKey("test.case.failure_url");
	public static final AttributeKey<String> CASE_SCREENSHOT_PATH = stringKey("test.case.screenshot_path");

	public static final AttributeKey<String> ACTION_TYPE = stringKey("test.action.type");
	public static final AttributeKey<String> ACTION_SELECTOR = stringKey("test.action.selector");
	public static final AttributeKey<String> ACTION_TARGET_URL = stringKey("test.action.target_url");
	public static final AttributeKey<String> ACTION_PAGE_URL = stringKey("test.action.page_url");
	public static final AttributeKey<String> ACTION_INPUT_VALUE = stringKey("test.action.input_value");
	public static final AttributeKey<String> ACTION_RESULT = stringKey("test.action.result");
	public static final AttributeKey<String> ACTION_ERROR = stringKey("test.action.error");
	public static final AttributeKey<Long> ACTION_WAIT_MS = longKey("test.action.wait_ms");
	public static final AttributeKey<Long> ACTION_DURATION_MS = longKey("test.action.duration_ms");
	public static final AttributeKey<Long> ACTION_EXPECTED_COUNT = longKey("test.action.expected_count");
	public static final AttributeKey<Long> ACTION_ACTUAL_COUNT = longKey("test.action.actual_count");

	public static final AttributeKey<Long> NAVIGATION_RESPONSE_STATUS = longKey("test.navigation.response_status");
	public static final AttributeKey<Double> NAVIGATION_DOM_CONTENT_LOADED_MS = doubleKey("test.navigation.dom_content_loaded_ms");
	public static final AttributeKey<Double> NAVIGATION_DOM_INTERACTIVE_MS = doubleKey("test.navigation.dom_interactive_ms");
	public static final AttributeKey<Double> NAVIGATION_LOAD_EVENT_MS = doubleKey("test.navigation.load_event_ms");
	public static final AttributeKey<Long> NAVIGATION_TRANSFER_SIZE_BYTES = longKey("test.navigation.transfer_size_bytes");
}
