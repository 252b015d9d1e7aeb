package works.smokeshow.spans;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.stream.Collectors.toList;

/**
 * Keeps every span it is asked to export, unlike {@code InMemorySpanExporter},
 * which discards them on shutdown. Can be told to fail.
 */
public class RecordingSpanExporter implements SpanExporter {
	private final List<SpanData> exported = new CopyOnWriteArrayList<>();
	private volatile Mode mode = Mode.ACCEPT;
	private volatile boolean isShutdown = false;
	private volatile int exportCalls = 0;

	public enum Mode {
		ACCEPT,

		/**
		 * Return a failed result, as an unreachable collector would.
		 */
		FAIL,

		/**
		 * Throw from every method.
		 */
		THROW,
	}

	public RecordingSpanExporter mode(Mode mode) {
		this.mode = mode;
		return this;
	}

	public List<SpanData> exported() {
		return List.copyOf(exported);
	}

	public int exportCalls() {
		return exportCalls;
	}

	public boolean isShutdown() {
		return isShutdown;
	}

	/**
	 * @return the one exported span with the given name
	 */
	public SpanData span(String name) {
		List<SpanData> matches = spansNamed(name);
		if (matches.size() != 1) {
			throw new AssertionError("Expected exactly one span named " + name + "; found " + matches.size() + " among " + names());
		}
		return matches.get(0);
	}

	public List<SpanData> spansNamed(String name) {
		return exported.stream()
			.filter(s -> s.getName().equals(name))
			.collect(toList());
	}

	public List<String> names() {
		return exported.stream()
			.map(SpanData::getName)
			.collect(toList());
	}

	@Override
	public CompletableResultCode export(Collection<SpanData> spans) {
		exportCalls++;
		switch (mode) {
			case FAIL:
				return CompletableResultCode.ofFailure();
			case THROW:
				throw new IllegalStateException("Collector unreachable");
			default:
				exported.addAll(spans);
				return CompletableResultCode.ofSuccess();
		}
	}

	@Override
	public CompletableResultCode flush() {
		if (mode == Mode.THROW) {
			throw new IllegalStateException("Collector unreachable");
		}
		return mode == Mode.FAIL ? CompletableResultCode.ofFailure() : CompletableResultCode.ofSuccess();
	}

	@Override
	public CompletableResultCode shutdown() {
		isShutdown = true;
		if (mode == Mode.THROW) {
			throw new IllegalStateException("Collector unreachable");
		}
		return mode == Mode.FAIL ? CompletableResultCode.ofFailure() : CompletableResultCode.ofSuccess();
	}
}
