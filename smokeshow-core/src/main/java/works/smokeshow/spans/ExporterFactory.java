package works.smokeshow.spans;

import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import works.smokeshow.config.SmokeshowConfig;

/**
 * Creates the {@link SpanExporter} through which a suite run's spans leave the process.
 */
@FunctionalInterface
public interface ExporterFactory {
	SpanExporter create(SmokeshowConfig config);

	/**
	 * OTLP over gRPC to {@link SmokeshowConfig#otlpEndpoint()}.
	 */
	static ExporterFactory otlp() {
		return config -> OtlpGrpcSpanExporter.builder()
			.setEndpoint(config.otlpEndpoint())
			.build();
	}
}
