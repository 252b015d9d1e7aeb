package works.smokeshow.spans;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;

/**
 * Opens, annotates, and closes spans identified by their span ID.
 * <p>
 * Parentage is always explicit: the caller passes the ID of the parent span,
 * and nothing here consults {@link Context#current()}. A child can only be opened
 * under a parent that is still open, and a parent can only be closed once all of
 * its children are closed.
 * <p>
 * Closing a span ends the underlying OpenTelemetry {@link Span}, which hands it to
 * the exporter. After that, the span is immutable: attribute and status writes throw
 * {@link SpanClosedException}, and closing it again does nothing.
 */
public class SpanRecorder {
	private final Tracer tracer;

	/**
	 * Every span this recorder has opened, in the order they were opened.
	 * Closed spans are retained so that repeated closes can be recognized.
	 */
	private final Map<String, Entry> spans = new LinkedHashMap<>();

	private static final class Entry {
		final Span span;
		final String name;
		final @Nullable Entry parent;
		final long startNanos;
		int openChildren = 0;

		/**
		 * null while the span is open.
		 */
		@Nullable Duration duration = null;

		Entry(Span span, String name, @Nullable Entry parent, long startNanos) {
			this.span = span;
			this.name = name;
			this.parent = parent;
			this.startNanos = startNanos;
		}

		boolean isOpen() {
			return duration == null;
		}
	}

	public SpanRecorder(@NonNull Tracer tracer) {
		this.tracer = tracer;
	}

	/**
	 * @param parentId the span under which to open the new one, or null for a root span in a new trace
	 * @return the ID of the new span
	 * @throws IllegalStateException if the parent is already closed
	 */
	public synchronized String open(@Nullable String parentId, @NonNull String name) {
		SpanBuilder builder = tracer.spanBuilder(name);
		Entry parent;
		if (parentId == null) {
			parent = null;
			builder.setNoParent();
		} else {
			parent = entry(parentId);
			if (!parent.isOpen()) {
				throw new IllegalStateException(format("Cannot open span \"%s\" under closed parent \"%s\"", name, parent.name));
			}
			builder.setParent(Context.root().with(parent.span));
		}
		Span span = builder.startSpan();
		String spanId = span.getSpanContext().getSpanId();
		spans.put(spanId, new Entry(span, name, parent, System.nanoTime()));
		if (parent != null) {
			parent.openChildren++;
		}
		LOGGER.trace("Opened span {} \"{}\" under {}", spanId, name, parentId);
		return spanId;
	}

	/**
	 * Later writes to the same key overwrite earlier ones.
	 * A null <code>value</code> is ignored.
	 */
	public synchronized <T> void setAttribute(String spanId, @NonNull AttributeKey<T> key, @Nullable T value) {
		Entry entry = openEntry(spanId, key.getKey());
		if (value != null) {
			entry.span.setAttribute(key, value);
		}
	}

	public synchronized void setStatus(String spanId, @NonNull StatusCode code, @Nullable String message) {
		Entry entry = openEntry(spanId, "status");
		if (message == null) {
			entry.span.setStatus(code);
		} else {
			entry.span.setStatus(code, message);
		}
	}

	public synchronized void recordException(String spanId, @NonNull Throwable exception) {
		openEntry(spanId, "exception").span.recordException(exception);
	}

	/**
	 * Ends the span, which causes it to be exported.
	 * Closing an already-closed span has no effect.
	 *
	 * @return the wall-clock time the span was open
	 * @throws IllegalStateException if the span still has open children
	 */
	public synchronized Duration close(String spanId) {
		Entry entry = entry(spanId);
		if (!entry.isOpen()) {
			LOGGER.debug("Span {} \"{}\" is already closed", spanId, entry.name);
			return entry.duration;
		}
		if (entry.openChildren > 0) {
			throw new IllegalStateException(format("Cannot close span \"%s\" while %d of its children remain open", entry.name, entry.openChildren));
		}
		Duration duration = Duration.ofNanos(System.nanoTime() - entry.startNanos);
		entry.duration = duration;
		entry.span.end();
		if (entry.parent != null) {
			entry.parent.openChildren--;
		}
		LOGGER.trace("Closed span {} \"{}\" after {}", spanId, entry.name, duration);
		return duration;
	}

	public synchronized boolean isOpen(String spanId) {
		return entry(spanId).isOpen();
	}

	/**
	 * @return IDs of spans that have been opened but not closed, parents before children
	 */
	public synchronized List<String> openSpans() {
		List<String> result = new ArrayList<>();
		spans.forEach((id, entry) -> {
			if (entry.isOpen()) {
				result.add(id);
			}
		});
		return result;
	}

	public synchronized String name(String spanId) {
		return entry(spanId).name;
	}

	public synchronized SpanContext spanContext(String spanId) {
		return entry(spanId).span.getSpanContext();
	}

	public String traceId(String spanId) {
		return spanContext(spanId).getTraceId();
	}

	private Entry entry(String spanId) {
		Entry entry = spans.get(spanId);
		if (entry == null) {
			throw new IllegalArgumentException("No such span: " + spanId);
		}
		return entry;
	}

	private Entry openEntry(String spanId, String what) {
		Entry entry = entry(spanId);
		if (!entry.isOpen()) {
			throw new SpanClosedException(format("Cannot set %s on closed span \"%s\"", what, entry.name));
		}
		return entry;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SpanRecorder.class);
}
