package works.smokeshow.redaction;

import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a form value is sensitive, and replaces it with {@link #REDACTED} if so.
 * <p>
 * A value is sensitive if the caller says so, or if its selector mentions one of
 * {@link #SENSITIVE_KEYWORDS}, ignoring case. Only the selector is examined:
 * the shape of the value itself plays no part.
 */
public final class Redaction {
	private Redaction() {}

	public static final String REDACTED = "[REDACTED]";

	public static final List<String> SENSITIVE_KEYWORDS = List.of(
		"password", "card", "cvv", "ssn", "credit", "secret", "token");

	public static boolean shouldRedact(@Nullable String selector, boolean sensitive) {
		if (sensitive) {
			return true;
		}
		if (selector == null) {
			return false;
		}
		String lowered = selector.toLowerCase(Locale.ROOT);
		for (String keyword: SENSITIVE_KEYWORDS) {
			if (lowered.contains(keyword)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Always returns {@link #REDACTED}.
	 */
	public static String redactValue(@Nullable String value) {
		return REDACTED;
	}

	public static String redactIfNeeded(String value, @Nullable String selector, boolean sensitive) {
		return shouldRedact(selector, sensitive) ? redactValue(value) : value;
	}

	/**
	 * @return <code>message</code> with every occurrence of <code>secret</code> replaced by {@link #REDACTED}
	 */
	public static @Nullable String scrub(@Nullable String message, @Nullable String secret) {
		if (message == null || secret == null || secret.isEmpty()) {
			return message;
		}
		return message.replace(secret, REDACTED);
	}
}
