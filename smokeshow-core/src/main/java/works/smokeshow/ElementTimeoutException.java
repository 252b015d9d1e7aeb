package works.smokeshow;

/**
 * Thrown by a {@link BrowserDriver} when an element does not reach the awaited state in time.
 * The action is recorded with <code>test.action.result=timeout</code>.
 */
@SuppressWarnings("serial")
public class ElementTimeoutException extends RuntimeException {
	public ElementTimeoutException(String message) { super(message); }
	public ElementTimeoutException(String message, Throwable cause) { super(message, cause); }
}
