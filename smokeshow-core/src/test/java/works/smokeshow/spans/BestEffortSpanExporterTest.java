package works.smokeshow.spans;

import ch.qos.logback.classic.Level;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.smokeshow.LogCapture;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static works.smokeshow.spans.RecordingSpanExporter.Mode.FAIL;
import static works.smokeshow.spans.RecordingSpanExporter.Mode.THROW;

class BestEffortSpanExporterTest {
	RecordingSpanExporter downstream;
	BestEffortSpanExporter exporter;
	LogCapture log;

	@BeforeEach
	void setup() {
		downstream = new RecordingSpanExporter();
		exporter = new BestEffortSpanExporter(downstream);
		log = new LogCapture(BestEffortSpanExporter.class);
	}

	@AfterEach
	void teardown() {
		log.close();
	}

	@Test
	void healthyExporter_passesThroughQuietly() {
		CompletableResultCode result = exporter.export(List.of());
		assertThat(result.isSuccess(), is(true));
		assertThat(exporter.flush().isSuccess(), is(true));
		assertThat(exporter.shutdown().isSuccess(), is(true));
		assertThat(downstream.exportCalls(), is(1));
		assertThat(log.messages(Level.WARN), is(empty()));
	}

	@Test
	void throwingExporter_failureReturnedAndWarned() {
		downstream.mode(THROW);
		CompletableResultCode result = exporter.export(List.of());
		assertThat(result.isSuccess(), is(false));
		assertThat(log.messages(Level.WARN), contains(containsString("threw an exception")));
	}

	@Test
	void failingExporter_warned() {
		downstream.mode(FAIL);
		CompletableResultCode result = exporter.export(List.of());
		assertThat(result.isSuccess(), is(false));
		assertThat(log.messages(Level.WARN), contains(containsString("export failed")));
	}

	@Test
	void throwingShutdown_doesNotThrow() {
		downstream.mode(THROW);
		assertThat(exporter.flush().isSuccess(), is(false));
		assertThat(exporter.shutdown().isSuccess(), is(false));
		assertThat(downstream.isShutdown(), is(true));
		assertThat(log.messages(Level.WARN), hasSize(2));
	}

	@Test
	void nullResult_treatedAsFailure() {
		SpanExporter broken = new SpanExporter() {
			@Override
			public CompletableResultCode export(Collection<SpanData> spans) {
				return null;
			}

			@Override
			public CompletableResultCode flush() {
				return null;
			}

			@Override
			public CompletableResultCode shutdown() {
				return null;
			}
		};
		assertThat(new BestEffortSpanExporter(broken).export(List.of()).isSuccess(), is(false));
		assertThat(log.messages(Level.WARN), contains(containsString("returned no result")));
	}
}
