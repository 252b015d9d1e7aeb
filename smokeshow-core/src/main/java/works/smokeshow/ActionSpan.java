package works.smokeshow;

import io.opentelemetry.api.common.AttributeKey;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import works.smokeshow.spans.SpanRecorder;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static works.smokeshow.spans.SpanAttributes.ACTION_WAIT_MS;

/**
 * The span of an action that is in progress, as seen by its {@link ActionBody}.
 */
@RequiredArgsConstructor
public final class ActionSpan {
	private final SpanRecorder recorder;
	private final String spanId;
	private long waitNanos = 0;

	public String spanId() {
		return spanId;
	}

	public <T> ActionSpan setAttribute(AttributeKey<T> key, T value) {
		recorder.setAttribute(spanId, key, value);
		return this;
	}

	/**
	 * Runs <code>precondition</code>, adding the time it takes to
	 * <code>test.action.wait_ms</code>. The time is recorded even if it fails.
	 */
	public <T> T timeWait(Supplier<T> precondition) {
		long start = System.nanoTime();
		try {
			return precondition.get();
		} finally {
			waitNanos += System.nanoTime() - start;
			recorder.setAttribute(spanId, ACTION_WAIT_MS, NANOSECONDS.toMillis(waitNanos));
		}
	}

	public void timeWait(Runnable precondition) {
		timeWait(() -> {
			precondition.run();
			return null;
		});
	}
}
