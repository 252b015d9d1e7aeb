package works.smokeshow;

import java.time.Duration;

/**
 * The browser operations that instrumented actions delegate to.
 * <p>
 * Implementations report failure by throwing an unchecked exception;
 * a wait that runs out of time should throw {@link ElementTimeoutException}.
 * Managing the browser process itself is the implementation's business.
 * <p>
 * Selectors are CSS selectors.
 */
public interface BrowserDriver {
	NavigationResult navigate(String url);

	void click(String selector);

	void fill(String selector, String value);

	/**
	 * Blocks until the element matching <code>selector</code> is in the given <code>state</code>.
	 *
	 * @throws ElementTimeoutException if that doesn't happen within <code>timeout</code>
	 */
	void waitForState(String selector, ElementState state, Duration timeout);

	String getText(String selector);

	int countMatches(String selector);

	String currentUrl();

	/**
	 * @return PNG image of the current viewport
	 */
	byte[] screenshot();
}
