package works.smokeshow;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.config.ConfigResolver;
import works.smokeshow.config.SmokeshowConfig;
import works.smokeshow.config.SmokeshowSettings;
import works.smokeshow.logging.MdcScope;
import works.smokeshow.spans.ExporterConnection;
import works.smokeshow.spans.ExporterFactory;
import works.smokeshow.spans.SpanRecorder;
import works.smokeshow.vcs.VcsMetadata;

import static io.opentelemetry.api.trace.StatusCode.ERROR;
import static io.opentelemetry.api.trace.StatusCode.OK;
import static java.util.UUID.randomUUID;
import static works.smokeshow.logging.MdcKeys.RUN_ID;
import static works.smokeshow.logging.MdcKeys.SUITE;
import static works.smokeshow.logging.MdcKeys.TEST_CASE;
import static works.smokeshow.spans.SpanAttributes.BROWSER_HEADLESS;
import static works.smokeshow.spans.SpanAttributes.BROWSER_NAME;
import static works.smokeshow.spans.SpanAttributes.RUN_TIMESTAMP;
import static works.smokeshow.spans.SpanAttributes.RUN_TRIGGER;
import static works.smokeshow.spans.SpanAttributes.SUITE_FAILED;
import static works.smokeshow.spans.SpanAttributes.SUITE_ID;
import static works.smokeshow.spans.SpanAttributes.SUITE_NAME;
import static works.smokeshow.spans.SpanAttributes.SUITE_PASSED;
import static works.smokeshow.spans.SpanAttributes.SUITE_RESULT;
import static works.smokeshow.spans.SpanAttributes.SUITE_TOTAL_TESTS;
import static works.smokeshow.spans.SpanAttributes.TARGET_BASE_URL;
import static works.smokeshow.spans.SpanAttributes.TARGET_ENVIRONMENT;
import static works.smokeshow.spans.SpanAttributes.VCS_BRANCH;
import static works.smokeshow.spans.SpanAttributes.VCS_COMMIT_SHA;
import static works.smokeshow.spans.SpanAttributes.VIEWPORT_HEIGHT;
import static works.smokeshow.spans.SpanAttributes.VIEWPORT_WIDTH;

/**
 * One run of a test suite, traced as a single trace whose root span is the suite.
 * <p>
 * Typical usage:
 *
 * <pre>
 * try (SuiteRun suite = SuiteRun.open(settings, driver)) {
 *     suite.testCase(TestCaseInfo.named("login"), test -&gt; {
 *         test.navigate("http://localhost:8080");
 *         test.fill("input#password", "hunter2");
 *         test.assertVisible("h1");
 *     });
 * }
 * </pre>
 *
 * Opening a suite run resolves the configuration, connects to the exporter, and opens
 * the root span. Each {@link #testCase} adds a child span and reports its outcome here.
 * {@link #close() Closing} the suite run writes the totals, closes the root span, and
 * disconnects from the exporter.
 * <p>
 * Test cases run one at a time on the caller's thread.
 */
public final class SuiteRun implements AutoCloseable {
	private final SmokeshowConfig config;
	private final BrowserDriver driver;
	private final ExporterConnection connection;
	private final SpanRecorder recorder;
	private final String runId = randomUUID().toString();
	private final String rootSpanId;
	private int passed = 0;
	private int failed = 0;
	private boolean isFinalized = false;

	private SuiteRun(SmokeshowConfig config, BrowserDriver driver, ExporterConnection connection, VcsMetadata vcs) {
		this.config = config;
		this.driver = driver;
		this.connection = connection;
		this.recorder = new SpanRecorder(connection.tracer());
		this.rootSpanId = recorder.open(null, "suite(\"" + config.suiteName() + "\")");

		recorder.setAttribute(rootSpanId, SUITE_NAME, config.suiteName());
		recorder.setAttribute(rootSpanId, SUITE_ID, runId);
		recorder.setAttribute(rootSpanId, RUN_TRIGGER, config.trigger());
		recorder.setAttribute(rootSpanId, RUN_TIMESTAMP, Instant.now().toString());
		recorder.setAttribute(rootSpanId, TARGET_BASE_URL, config.baseUrl());
		recorder.setAttribute(rootSpanId, TARGET_ENVIRONMENT, config.environment());
		recorder.setAttribute(rootSpanId, BROWSER_NAME, config.browser());
		recorder.setAttribute(rootSpanId, BROWSER_HEADLESS, config.headless());
		recorder.setAttribute(rootSpanId, VIEWPORT_WIDTH, (long) config.viewportWidth());
		recorder.setAttribute(rootSpanId, VIEWPORT_HEIGHT, (long) config.viewportHeight());
		recorder.setAttribute(rootSpanId, VCS_COMMIT_SHA, vcs.commitSha());
		recorder.setAttribute(rootSpanId, VCS_BRANCH, vcs.branch());
	}

	/**
	 * Opens a suite run configured from <code>settings</code> over the process environment,
	 * exporting over OTLP.
	 */
	public static SuiteRun open(@NonNull SmokeshowSettings settings, @NonNull BrowserDriver driver) {
		return builder().settings(settings).driver(driver).open();
	}

	/**
	 * @param settings explicit configuration; defaults to {@link SmokeshowSettings#none()}
	 * @param environment source of environment variables; defaults to {@link System#getenv()}
	 * @param exporterFactory defaults to {@link ExporterFactory#otlp()}
	 * @param vcs defaults to {@link VcsMetadata#fromGit()}
	 */
	@Builder(builderClassName = "Opener", buildMethodName = "open")
	private static SuiteRun create(
		@NonNull BrowserDriver driver,
		@Nullable SmokeshowSettings settings,
		@Nullable Map<String, String> environment,
		@Nullable ExporterFactory exporterFactory,
		@Nullable Supplier<VcsMetadata> vcs
	) {
		SmokeshowConfig config = ConfigResolver.resolve(
			settings == null ? SmokeshowSettings.none() : settings,
			environment == null ? System.getenv() : environment);
		VcsMetadata vcsMetadata = (vcs == null) ? VcsMetadata.fromGit() : vcs.get();
		ExporterConnection connection = ExporterConnection.open(
			config,
			exporterFactory == null ? ExporterFactory.otlp() : exporterFactory);
		SuiteRun result;
		try {
			result = new SuiteRun(config, driver, connection, vcsMetadata);
		} catch (RuntimeException | Error e) {
			connection.close();
			throw e;
		}
		try (
			var __ = MdcScope.put(SUITE, config.suiteName());
			var ___ = MdcScope.put(RUN_ID, result.runId)
		) {
			LOGGER.info("Suite \"{}\" started: run {}, trace {}", config.suiteName(), result.runId, result.traceId());
		}
		return result;
	}

	/**
	 * Runs <code>body</code> as a test case: opens its span, runs the body, records the outcome,
	 * and closes the span, whatever the body does.
	 * Anything the body throws is recorded and then rethrown unchanged.
	 */
	public void testCase(@NonNull TestCaseInfo info, @NonNull TestBody body) {
		if (isFinalized) {
			throw new IllegalStateException("Suite run " + runId + " is already closed");
		}
		try (
			var __ = MdcScope.put(SUITE, config.suiteName());
			var ___ = MdcScope.put(RUN_ID, runId);
			var ____ = MdcScope.put(TEST_CASE, info.label())
		) {
			TestCase testCase = new TestCase(this, info, recorder, rootSpanId, driver);
			Throwable failure = null;
			try {
				body.run(testCase);
			} catch (Throwable t) {
				failure = t;
				throw t;
			} finally {
				testCase.finish(failure);
			}
		}
	}

	public void testCase(String name, TestBody body) {
		testCase(TestCaseInfo.named(name), body);
	}

	/**
	 * Called exactly once by each test case as it finishes.
	 */
	void report(TestCase testCase, TestOutcome outcome) {
		if (isFinalized) {
			LOGGER.warn("Ignoring outcome {} of {} reported after suite run {} closed", outcome.id(), testCase, runId);
			return;
		}
		switch (outcome) {
			case PASSED:
				passed++;
				break;
			case FAILED:
				failed++;
				break;
		}
		LOGGER.debug("{} {}; {} passed, {} failed so far", testCase, outcome.id(), passed, failed);
	}

	public SmokeshowConfig config() {
		return config;
	}

	public String runId() {
		return runId;
	}

	public String traceId() {
		return recorder.traceId(rootSpanId);
	}

	public int passed() {
		return passed;
	}

	public int failed() {
		return failed;
	}

	public int total() {
		return passed + failed;
	}

	/**
	 * Finalizes the suite span and disconnects from the exporter.
	 * Spans that are somehow still open are closed with an error status first.
	 * Calling this again has no effect.
	 */
	@Override
	public void close() {
		if (isFinalized) {
			return;
		}
		isFinalized = true;
		try (
			var __ = MdcScope.put(SUITE, config.suiteName());
			var ___ = MdcScope.put(RUN_ID, runId)
		) {
			try {
				closeOrphans();
				SuiteResult result = SuiteResult.of(passed, failed);
				recorder.setAttribute(rootSpanId, SUITE_TOTAL_TESTS, (long) total());
				recorder.setAttribute(rootSpanId, SUITE_PASSED, (long) passed);
				recorder.setAttribute(rootSpanId, SUITE_FAILED, (long) failed);
				recorder.setAttribute(rootSpanId, SUITE_RESULT, result.id());
				if (failed == 0) {
					recorder.setStatus(rootSpanId, OK, null);
				} else {
					recorder.setStatus(rootSpanId, ERROR, failed + " of " + total() + " test cases failed");
				}
				recorder.close(rootSpanId);
				LOGGER.info("Suite \"{}\" {}: {} passed, {} failed", config.suiteName(), result.id(), passed, failed);
			} finally {
				connection.close();
			}
		}
	}

	/**
	 * Closes, innermost first, any span other than the root that is still open.
	 * This can only happen if the suite is closed from inside one of its own test cases.
	 */
	private void closeOrphans() {
		List<String> open = recorder.openSpans();
		for (int i = open.size() - 1; i >= 0; i--) {
			String spanId = open.get(i);
			if (!spanId.equals(rootSpanId)) {
				LOGGER.warn("Span \"{}\" was still open when suite run {} closed; closing it as orphaned", recorder.name(spanId), runId);
				recorder.setStatus(spanId, ERROR, ORPHANED);
				recorder.close(spanId);
			}
		}
	}

	static final String ORPHANED = "orphaned: still open when the suite run closed";

	private static final Logger LOGGER = LoggerFactory.getLogger(SuiteRun.class);
}
