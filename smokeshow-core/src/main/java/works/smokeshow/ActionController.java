package works.smokeshow;

import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.redaction.Redaction;
import works.smokeshow.spans.SpanRecorder;

import static io.opentelemetry.api.trace.StatusCode.ERROR;
import static io.opentelemetry.api.trace.StatusCode.OK;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static works.smokeshow.ActionType.ASSERT_COUNT;
import static works.smokeshow.ActionType.ASSERT_TEXT;
import static works.smokeshow.ActionType.ASSERT_URL;
import static works.smokeshow.ActionType.ASSERT_VISIBLE;
import static works.smokeshow.ActionType.CLICK;
import static works.smokeshow.ActionType.FILL;
import static works.smokeshow.ActionType.NAVIGATE;
import static works.smokeshow.ElementState.VISIBLE;
import static works.smokeshow.spans.SpanAttributes.ACTION_ACTUAL_COUNT;
import static works.smokeshow.spans.SpanAttributes.ACTION_DURATION_MS;
import static works.smokeshow.spans.SpanAttributes.ACTION_ERROR;
import static works.smokeshow.spans.SpanAttributes.ACTION_EXPECTED_COUNT;
import static works.smokeshow.spans.SpanAttributes.ACTION_INPUT_VALUE;
import static works.smokeshow.spans.SpanAttributes.ACTION_PAGE_URL;
import static works.smokeshow.spans.SpanAttributes.ACTION_RESULT;
import static works.smokeshow.spans.SpanAttributes.ACTION_SELECTOR;
import static works.smokeshow.spans.SpanAttributes.ACTION_TARGET_URL;
import static works.smokeshow.spans.SpanAttributes.ACTION_TYPE;
import static works.smokeshow.spans.SpanAttributes.NAVIGATION_DOM_CONTENT_LOADED_MS;
import static works.smokeshow.spans.SpanAttributes.NAVIGATION_DOM_INTERACTIVE_MS;
import static works.smokeshow.spans.SpanAttributes.NAVIGATION_LOAD_EVENT_MS;
import static works.smokeshow.spans.SpanAttributes.NAVIGATION_RESPONSE_STATUS;
import static works.smokeshow.spans.SpanAttributes.NAVIGATION_TRANSFER_SIZE_BYTES;

/**
 * Runs browser operations inside action spans that are children of one test-case span.
 * <p>
 * Every action span records its type, selector, the page URL at the start of the action,
 * its duration, and a result of <code>success</code>, <code>failed</code>, or <code>timeout</code>.
 * A failing operation is recorded on the span and then rethrown unchanged.
 */
@RequiredArgsConstructor
public class ActionController {
	@NonNull private final SpanRecorder recorder;
	@NonNull private final String parentSpanId;
	@NonNull private final BrowserDriver driver;

	/**
	 * Failures of redacting fills, mapped to their already-scrubbed descriptions.
	 * Throwable doesn't override <code>equals</code>, so lookups are by identity.
	 */
	private final Map<Throwable, String> scrubbedFailures = Collections.synchronizedMap(new WeakHashMap<>());

	public NavigationResult navigate(String url) {
		return run(NAVIGATE, null, action -> {
			action.setAttribute(ACTION_TARGET_URL, url);
			NavigationResult result = driver.navigate(url);
			if (result == null) {
				return NavigationResult.unknown();
			}
			if (result.status() != null) {
				action.setAttribute(NAVIGATION_RESPONSE_STATUS, result.status().longValue());
			}
			NavigationTiming timing = result.timing();
			if (timing != null) {
				action
					.setAttribute(NAVIGATION_DOM_CONTENT_LOADED_MS, timing.domContentLoadedMs())
					.setAttribute(NAVIGATION_DOM_INTERACTIVE_MS, timing.domInteractiveMs())
					.setAttribute(NAVIGATION_LOAD_EVENT_MS, timing.loadEventMs())
					.setAttribute(NAVIGATION_TRANSFER_SIZE_BYTES, timing.transferSizeBytes());
			}
			return result;
		});
	}

	public void click(String selector) {
		run(CLICK, selector, action -> {
			driver.click(selector);
			return null;
		});
	}

	/**
	 * The recorded <code>test.action.input_value</code> is {@link Redaction#REDACTED}
	 * if {@link Redaction#shouldRedact} says so; in that case <code>value</code>
	 * is also scrubbed from the error message recorded if this fill fails.
	 * The value itself is not kept once this method returns.
	 */
	public void fill(String selector, String value, boolean sensitive) {
		boolean redact = Redaction.shouldRedact(selector, sensitive);
		String recordedValue = redact ? Redaction.redactValue(value) : value;
		run(FILL.id(), selector, redact ? value : null, action -> {
			action.setAttribute(ACTION_INPUT_VALUE, recordedValue);
			driver.fill(selector, value);
			return null;
		});
	}

	public void assertVisible(String selector) {
		run(ASSERT_VISIBLE, selector, action -> {
			action.timeWait(() -> driver.waitForState(selector, VISIBLE, ASSERTION_TIMEOUT));
			return null;
		});
	}

	/**
	 * Passes if the element's text contains <code>expected</code>, ignoring case.
	 *
	 * @return the element's text
	 */
	public String assertText(String selector, String expected) {
		return run(ASSERT_TEXT, selector, action -> {
			action.timeWait(() -> driver.waitForState(selector, VISIBLE, ASSERTION_TIMEOUT));
			String text = driver.getText(selector);
			if (text == null || !text.toLowerCase(Locale.ROOT).contains(expected.toLowerCase(Locale.ROOT))) {
				throw new AssertionError(format("Expected '%s' in '%s'", expected, text));
			}
			return text;
		});
	}

	public void assertCount(String selector, int expectedCount) {
		run(ASSERT_COUNT, selector, action -> {
			int actual = driver.countMatches(selector);
			action
				.setAttribute(ACTION_EXPECTED_COUNT, (long) expectedCount)
				.setAttribute(ACTION_ACTUAL_COUNT, (long) actual);
			if (actual != expectedCount) {
				throw new AssertionError(format("Expected %d elements matching '%s', got %d", expectedCount, selector, actual));
			}
			return null;
		});
	}

	/**
	 * Passes if the current URL contains <code>pattern</code>.
	 */
	public void assertUrl(String pattern) {
		run(ASSERT_URL, null, action -> {
			String url = driver.currentUrl();
			if (url == null || !url.contains(pattern)) {
				throw new AssertionError(format("Expected '%s' in URL, got %s", pattern, url));
			}
			return null;
		});
	}

	public <T> T run(ActionType type, @Nullable String selector, ActionBody<T> body) {
		return run(type.id(), selector, null, body);
	}

	/**
	 * Runs <code>body</code> in an action span named <code>type(selector)</code>,
	 * or just <code>type</code> if <code>selector</code> is null.
	 */
	public <T> T run(String type, @Nullable String selector, ActionBody<T> body) {
		return run(type, selector, null, body);
	}

	/**
	 * @param secret if not null, is replaced by {@link Redaction#REDACTED} in recorded error messages
	 */
	private <T> T run(String type, @Nullable String selector, @Nullable String secret, ActionBody<T> body) {
		String spanId = recorder.open(parentSpanId, spanName(type, selector));
		recorder.setAttribute(spanId, ACTION_TYPE, type);
		recorder.setAttribute(spanId, ACTION_SELECTOR, selector);
		currentUrl().ifPresent(url -> recorder.setAttribute(spanId, ACTION_PAGE_URL, url));
		long start = System.nanoTime();
		try {
			T result = body.run(new ActionSpan(recorder, spanId));
			recorder.setAttribute(spanId, ACTION_RESULT, RESULT_SUCCESS);
			recorder.setStatus(spanId, OK, null);
			return result;
		} catch (Throwable t) {
			String description = describe(t);
			if (secret != null) {
				description = Redaction.scrub(description, secret);
				scrubbedFailures.put(t, description);
			}
			String message = failureMessage(description);
			recorder.setAttribute(spanId, ACTION_RESULT, (t instanceof ElementTimeoutException) ? RESULT_TIMEOUT : RESULT_FAILED);
			recorder.setAttribute(spanId, ACTION_ERROR, message);
			recorder.setStatus(spanId, ERROR, message);
			if (secret == null) {
				recorder.recordException(spanId, t);
			}
			LOGGER.debug("Action {} failed: {}", recorder.name(spanId), message);
			throw t;
		} finally {
			recorder.setAttribute(spanId, ACTION_DURATION_MS, NANOSECONDS.toMillis(System.nanoTime() - start));
			recorder.close(spanId);
		}
	}

	/**
	 * Best-effort: failing to learn the URL doesn't fail the action.
	 */
	Optional<String> currentUrl() {
		try {
			return Optional.ofNullable(driver.currentUrl());
		} catch (RuntimeException e) {
			LOGGER.debug("Unable to determine current URL", e);
			return Optional.empty();
		}
	}

	/**
	 * @return the scrubbed description recorded when <code>failure</code> escaped a redacting {@link #fill},
	 * or empty if it didn't
	 */
	Optional<String> scrubbedDescription(Throwable failure) {
		return Optional.ofNullable(scrubbedFailures.get(failure));
	}

	static String spanName(String type, @Nullable String selector) {
		return selector == null ? type : type + "(" + selector + ")";
	}

	static String describe(Throwable t) {
		String message = t.getMessage();
		return (message == null || message.isBlank()) ? t.getClass().getSimpleName() : message;
	}

	/**
	 * Marks failures that happened while the current thread was being interrupted.
	 */
	static String failureMessage(String description) {
		return Thread.currentThread().isInterrupted() ? "Interrupted: " + description : description;
	}

	public static final String RESULT_SUCCESS = "success";
	public static final String RESULT_FAILED = "failed";
	public static final String RESULT_TIMEOUT = "timeout";

	static final Duration ASSERTION_TIMEOUT = Duration.ofSeconds(5);

	private static final Logger LOGGER = LoggerFactory.getLogger(ActionController.class);
}
