package works.smokeshow.spans;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards to a downstream {@link SpanExporter}, converting every kind of
 * failure into a warning in the local log.
 * Nothing thrown by the downstream exporter reaches the caller.
 */
@RequiredArgsConstructor
public class BestEffortSpanExporter implements SpanExporter {
	@NonNull private final SpanExporter downstream;

	@Override
	public CompletableResultCode export(Collection<SpanData> spans) {
		return guarded("export", spans.size(), () -> downstream.export(spans));
	}

	@Override
	public CompletableResultCode flush() {
		return guarded("flush", 0, downstream::flush);
	}

	@Override
	public CompletableResultCode shutdown() {
		return guarded("shutdown", 0, downstream::shutdown);
	}

	private interface ExporterCall {
		CompletableResultCode call();
	}

	private CompletableResultCode guarded(String operation, int spanCount, ExporterCall call) {
		CompletableResultCode result;
		try {
			result = call.call();
		} catch (RuntimeException e) {
			LOGGER.warn("Span exporter {} threw an exception; {} span(s) dropped", operation, spanCount, e);
			return CompletableResultCode.ofFailure();
		}
		if (result == null) {
			LOGGER.warn("Span exporter {} returned no result; {} span(s) may have been dropped", operation, spanCount);
			return CompletableResultCode.ofFailure();
		}
		result.whenComplete(() -> {
			if (!result.isSuccess()) {
				LOGGER.warn("Span exporter {} failed; {} span(s) dropped", operation, spanCount);
			}
		});
		return result;
	}

	@Override
	public String toString() {
		return "BestEffortSpanExporter(" + downstream + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(BestEffortSpanExporter.class);
}
