package works.smokeshow;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * A {@link BrowserDriver} whose "page" is a map from selector to element.
 * Any selector not in the map matches nothing.
 */
public class FakeBrowserDriver implements BrowserDriver {
	String url = "about:blank";
	final Map<String, Element> elements = new HashMap<>();
	final Map<String, Integer> matchCounts = new HashMap<>();
	final List<String> calls = new ArrayList<>();
	NavigationResult navigationResult = new NavigationResult(200, null);
	RuntimeException failNextCurrentUrl = null;
	RuntimeException screenshotFailure = null;
	RuntimeException fillFailure = null;
	RuntimeException waitFailure = null;
	boolean interruptOnWait = false;

	static final class Element {
		String text;
		boolean visible = true;
		String value = "";
		int clicks = 0;

		Element(String text) {
			this.text = text;
		}
	}

	@SuppressWarnings("serial")
	public static final class NoSuchElementException extends RuntimeException {
		NoSuchElementException(String selector) {
			super("No element matches selector: " + selector);
		}
	}

	FakeBrowserDriver withElement(String selector, String text) {
		elements.put(selector, new Element(text));
		return this;
	}

	FakeBrowserDriver withHiddenElement(String selector) {
		Element element = new Element("");
		element.visible = false;
		elements.put(selector, element);
		return this;
	}

	FakeBrowserDriver withMatches(String selector, int count) {
		matchCounts.put(selector, count);
		return this;
	}

	Element element(String selector) {
		Element result = elements.get(selector);
		if (result == null) {
			throw new NoSuchElementException(selector);
		}
		return result;
	}

	@Override
	public NavigationResult navigate(String url) {
		calls.add("navigate " + url);
		this.url = url;
		return navigationResult;
	}

	@Override
	public void click(String selector) {
		calls.add("click " + selector);
		element(selector).clicks++;
	}

	@Override
	public void fill(String selector, String value) {
		calls.add("fill " + selector);
		if (fillFailure != null) {
			throw fillFailure;
		}
		element(selector).value = value;
	}

	@Override
	public void waitForState(String selector, ElementState state, Duration timeout) {
		calls.add("wait " + selector + " " + state);
		if (interruptOnWait) {
			Thread.currentThread().interrupt();
		}
		if (waitFailure != null) {
			throw waitFailure;
		}
		Element element = elements.get(selector);
		boolean satisfied;
		switch (state) {
			case ATTACHED:
				satisfied = element != null;
				break;
			case DETACHED:
				satisfied = element == null;
				break;
			case VISIBLE:
				satisfied = element != null && element.visible;
				break;
			default:
				satisfied = element == null || !element.visible;
				break;
		}
		if (!satisfied) {
			throw new ElementTimeoutException(format("Timeout %dms exceeded waiting for '%s' to be %s", timeout.toMillis(), selector, state));
		}
	}

	@Override
	public String getText(String selector) {
		return element(selector).text;
	}

	@Override
	public int countMatches(String selector) {
		return matchCounts.getOrDefault(selector, elements.containsKey(selector) ? 1 : 0);
	}

	@Override
	public String currentUrl() {
		if (failNextCurrentUrl != null) {
			RuntimeException e = failNextCurrentUrl;
			failNextCurrentUrl = null;
			throw e;
		}
		return url;
	}

	@Override
	public byte[] screenshot() {
		if (screenshotFailure != null) {
			throw screenshotFailure;
		}
		return "fake png".getBytes(StandardCharsets.UTF_8);
	}
}
