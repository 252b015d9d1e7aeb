package works.smokeshow.logging;

import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

/**
 * Like {@link org.slf4j.MDC.MDCCloseable} except that instead of deleting
 * the MDC entry at the end, it restores the entry's prior value,
 * so scopes for the same key can nest.
 *
 * <p>
 * In a try block using one of these, the catch and finally blocks run
 * after {@link #close()} and won't have the context.
 */
public final class MdcScope implements AutoCloseable {
	private final String key;
	private final @Nullable String oldValue;

	private MdcScope(String key, String value) {
		this.key = key;
		this.oldValue = MDC.get(key);
		MDC.put(key, value);
	}

	public static MdcScope put(String key, String value) {
		return new MdcScope(key, value);
	}

	@Override
	public void close() {
		if (oldValue == null) {
			MDC.remove(key);
		} else {
			MDC.put(key, oldValue);
		}
	}
}
