package works.smokeshow.spans;

/**
 * Thrown when code attempts to modify a span that has already been
 * {@link SpanRecorder#close closed}. A closed span is immutable.
 */
@SuppressWarnings("serial")
public class SpanClosedException extends IllegalStateException {
	public SpanClosedException(String message) { super(message); }
}
