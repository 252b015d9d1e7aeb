package works.smokeshow.spans;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.function.Supplier;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.config.SmokeshowConfig;

import static io.opentelemetry.api.common.AttributeKey.stringKey;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Owns the tracer provider and exporter for one suite run.
 * Every span is handed to the exporter as soon as it ends.
 * <p>
 * Exporter trouble of any kind, including failing to create the exporter in the
 * first place, is logged and otherwise ignored: telemetry is best-effort.
 */
public final class ExporterConnection implements AutoCloseable {
	private final SdkTracerProvider tracerProvider;
	private final Tracer tracer;
	private boolean isClosed = false;

	private ExporterConnection(SdkTracerProvider tracerProvider) {
		this.tracerProvider = tracerProvider;
		this.tracer = tracerProvider.get(INSTRUMENTATION_NAME, libraryVersion());
	}

	public static ExporterConnection open(@NonNull SmokeshowConfig config, @NonNull ExporterFactory factory) {
		SpanExporter exporter;
		try {
			exporter = factory.create(config);
		} catch (RuntimeException e) {
			LOGGER.warn("Unable to create span exporter for {}; spans will not be exported", config.otlpEndpoint(), e);
			exporter = SpanExporter.composite();
		}
		SdkTracerProvider provider = SdkTracerProvider.builder()
			.setResource(resourceFor(config))
			.addSpanProcessor(SimpleSpanProcessor.create(new BestEffortSpanExporter(exporter)))
			.build();
		LOGGER.debug("Opened exporter connection to {} using {}", config.otlpEndpoint(), exporter);
		return new ExporterConnection(provider);
	}

	public Tracer tracer() {
		return tracer;
	}

	/**
	 * Flushes pending exports and shuts the exporter down.
	 * Never throws; calling it again has no effect.
	 */
	@Override
	public synchronized void close() {
		if (isClosed) {
			return;
		}
		isClosed = true;
		awaitQuietly("flush", tracerProvider::forceFlush);
		awaitQuietly("shutdown", tracerProvider::shutdown);
	}

	private static void awaitQuietly(String operation, Supplier<CompletableResultCode> call) {
		try {
			CompletableResultCode result = call.get().join(CLOSE_TIMEOUT_SECONDS, SECONDS);
			if (!result.isSuccess()) {
				LOGGER.warn("Exporter {} did not complete successfully", operation);
			}
		} catch (RuntimeException e) {
			LOGGER.warn("Exporter {} failed", operation, e);
		}
	}

	static Resource resourceFor(SmokeshowConfig config) {
		return Resource.getDefault().merge(Resource.create(Attributes.of(
			stringKey("service.name"), config.serviceName(),
			stringKey("telemetry.sdk.name"), INSTRUMENTATION_NAME,
			stringKey("deployment.environment"), config.environment()
		)));
	}

	static String libraryVersion() {
		String result = ExporterConnection.class.getPackage().getImplementationVersion();
		if (result == null) {
			return "dev";
		} else {
			return result;
		}
	}

	public static final String INSTRUMENTATION_NAME = "smokeshow";
	private static final long CLOSE_TIMEOUT_SECONDS = 10;
	private static final Logger LOGGER = LoggerFactory.getLogger(ExporterConnection.class);
}
