package works.smokeshow.spans;

import ch.qos.logback.classic.Level;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.smokeshow.LogCapture;
import works.smokeshow.config.ConfigResolver;
import works.smokeshow.config.SmokeshowConfig;
import works.smokeshow.config.SmokeshowSettings;

import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.smokeshow.spans.RecordingSpanExporter.Mode.THROW;

class ExporterConnectionTest {
	final SmokeshowConfig config = ConfigResolver.resolve(
		SmokeshowSettings.builder()
			.serviceName("checkout-smoke")
			.environment("staging")
			.build(),
		Map.of());

	@Test
	void endedSpan_exportedImmediately() {
		RecordingSpanExporter exporter = new RecordingSpanExporter();
		try (ExporterConnection connection = ExporterConnection.open(config, c -> exporter)) {
			connection.tracer().spanBuilder("one").startSpan().end();
			assertEquals(1, exporter.exported().size());
		}
		assertTrue(exporter.isShutdown());
	}

	@Test
	void resource_describesService() {
		RecordingSpanExporter exporter = new RecordingSpanExporter();
		try (ExporterConnection connection = ExporterConnection.open(config, c -> exporter)) {
			connection.tracer().spanBuilder("one").startSpan().end();
		}
		Resource resource = exporter.span("one").getResource();
		assertEquals("checkout-smoke", resource.getAttribute(stringKey("service.name")));
		assertEquals("staging", resource.getAttribute(stringKey("deployment.environment")));
		assertEquals(ExporterConnection.INSTRUMENTATION_NAME, exporter.span("one").getInstrumentationScopeInfo().getName());
	}

	@Test
	void factoryThrows_spansDiscardedQuietly() {
		try (LogCapture log = new LogCapture(ExporterConnection.class)) {
			ExporterConnection connection = ExporterConnection.open(config, c -> {
				throw new IllegalArgumentException("Malformed endpoint");
			});
			assertDoesNotThrow(() -> connection.tracer().spanBuilder("dropped").startSpan().end());
			assertDoesNotThrow(connection::close);
			assertEquals(1, log.messages(Level.WARN).size());
		}
	}

	@Test
	void exporterThrowsEverywhere_closeDoesNotThrow() {
		RecordingSpanExporter exporter = new RecordingSpanExporter().mode(THROW);
		ExporterConnection connection = ExporterConnection.open(config, c -> exporter);
		connection.tracer().spanBuilder("lost").startSpan().end();
		assertDoesNotThrow(connection::close);
		assertDoesNotThrow(connection::close);
		assertTrue(exporter.isShutdown());
	}
}
