package works.smokeshow.selenium;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

/**
 * A page held in memory: a map from CSS selector to the elements it matches.
 * Scripts all return {@link #scriptResult}.
 */
class StubWebDriver implements WebDriver, JavascriptExecutor, TakesScreenshot {
	String currentUrl = "about:blank";
	final Map<By, List<StubWebElement>> elements = new HashMap<>();
	final List<String> visited = new ArrayList<>();
	final List<String> scripts = new ArrayList<>();
	Object scriptResult = null;
	boolean isQuit = false;

	static final byte[] PNG = "stub png".getBytes(StandardCharsets.UTF_8);

	StubWebElement add(String selector, String text) {
		StubWebElement element = new StubWebElement(text);
		elements.computeIfAbsent(By.cssSelector(selector), k -> new ArrayList<>()).add(element);
		return element;
	}

	@Override
	public void get(String url) {
		visited.add(url);
		currentUrl = url;
	}

	@Override
	public String getCurrentUrl() {
		return currentUrl;
	}

	@Override
	public String getTitle() {
		return "";
	}

	@Override
	public List<WebElement> findElements(By by) {
		return new ArrayList<>(elements.getOrDefault(by, List.of()));
	}

	@Override
	public WebElement findElement(By by) {
		List<StubWebElement> matches = elements.getOrDefault(by, List.of());
		if (matches.isEmpty()) {
			throw new NoSuchElementException("Unable to locate element: " + by);
		}
		return matches.get(0);
	}

	@Override
	public String getPageSource() {
		return "<html></html>";
	}

	@Override
	public void close() {
		isQuit = true;
	}

	@Override
	public void quit() {
		isQuit = true;
	}

	@Override
	public Set<String> getWindowHandles() {
		return Set.of("main");
	}

	@Override
	public String getWindowHandle() {
		return "main";
	}

	@Override
	public TargetLocator switchTo() {
		throw new UnsupportedOperationException();
	}

	@Override
	public Navigation navigate() {
		throw new UnsupportedOperationException();
	}

	@Override
	public Options manage() {
		throw new UnsupportedOperationException();
	}

	@Override
	public Object executeScript(String script, Object... args) {
		scripts.add(script);
		return scriptResult;
	}

	@Override
	public Object executeAsyncScript(String script, Object... args) {
		throw new UnsupportedOperationException();
	}

	@Override
	public <X> X getScreenshotAs(OutputType<X> target) {
		return target.convertFromPngBytes(PNG);
	}
}
