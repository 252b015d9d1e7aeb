package works.smokeshow.selenium;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.BrowserDriver;
import works.smokeshow.ElementState;
import works.smokeshow.ElementTimeoutException;
import works.smokeshow.NavigationResult;
import works.smokeshow.NavigationTiming;

import static java.lang.String.format;
import static org.openqa.selenium.support.ui.ExpectedConditions.invisibilityOfElementLocated;
import static org.openqa.selenium.support.ui.ExpectedConditions.numberOfElementsToBe;
import static org.openqa.selenium.support.ui.ExpectedConditions.presenceOfElementLocated;
import static org.openqa.selenium.support.ui.ExpectedConditions.visibilityOfElementLocated;

/**
 * A {@link BrowserDriver} backed by a Selenium {@link WebDriver}.
 * Selectors are CSS selectors.
 * <p>
 * Closing this quits the browser.
 */
public class SeleniumBrowserDriver implements BrowserDriver, AutoCloseable {
	private final WebDriver webDriver;

	public SeleniumBrowserDriver(@NonNull WebDriver webDriver) {
		this.webDriver = webDriver;
	}

	public WebDriver webDriver() {
		return webDriver;
	}

	/**
	 * Loads <code>url</code>, then asks the page for its Navigation Timing entry.
	 * The response status and timing are left unknown if the browser can't supply them.
	 */
	@Override
	public NavigationResult navigate(String url) {
		webDriver.get(url);
		return navigationResult(navigationEntry());
	}

	@Override
	public void click(String selector) {
		find(selector).click();
	}

	@Override
	public void fill(String selector, String value) {
		WebElement element = find(selector);
		element.clear();
		element.sendKeys(value);
	}

	@Override
	public void waitForState(String selector, ElementState state, Duration timeout) {
		By by = By.cssSelector(selector);
		WebDriverWait wait = new WebDriverWait(webDriver, timeout);
		try {
			switch (state) {
				case ATTACHED:
					wait.until(presenceOfElementLocated(by));
					break;
				case DETACHED:
					wait.until(numberOfElementsToBe(by, 0));
					break;
				case VISIBLE:
					wait.until(visibilityOfElementLocated(by));
					break;
				case HIDDEN:
					wait.until(invisibilityOfElementLocated(by));
					break;
			}
		} catch (TimeoutException e) {
			throw new ElementTimeoutException(
				format("Timeout %dms exceeded waiting for '%s' to be %s", timeout.toMillis(), selector, state.name().toLowerCase(Locale.ROOT)),
				e);
		}
	}

	@Override
	public String getText(String selector) {
		return find(selector).getText();
	}

	@Override
	public int countMatches(String selector) {
		return webDriver.findElements(By.cssSelector(selector)).size();
	}

	@Override
	public String currentUrl() {
		return webDriver.getCurrentUrl();
	}

	@Override
	public byte[] screenshot() {
		if (webDriver instanceof TakesScreenshot) {
			return ((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES);
		} else {
			throw new UnsupportedOperationException(webDriver.getClass().getSimpleName() + " can't take screenshots");
		}
	}

	@Override
	public void close() {
		LOGGER.debug("Quitting {}", webDriver);
		webDriver.quit();
	}

	private WebElement find(String selector) {
		return webDriver.findElement(By.cssSelector(selector));
	}

	private @Nullable Map<?, ?> navigationEntry() {
		if (!(webDriver instanceof JavascriptExecutor)) {
			return null;
		}
		try {
			Object result = ((JavascriptExecutor) webDriver).executeScript(NAVIGATION_TIMING_SCRIPT);
			if (result instanceof Map) {
				return (Map<?, ?>) result;
			} else {
				return null;
			}
		} catch (WebDriverException e) {
			LOGGER.debug("Navigation timing unavailable", e);
			return null;
		}
	}

	static NavigationResult navigationResult(@Nullable Map<?, ?> entry) {
		if (entry == null) {
			return NavigationResult.unknown();
		}
		Number status = number(entry, "responseStatus");
		Number domContentLoaded = number(entry, "domContentLoaded");
		Number domInteractive = number(entry, "domInteractive");
		Number loadEvent = number(entry, "loadEvent");
		Number transferSize = number(entry, "transferSize");
		NavigationTiming timing;
		if (domContentLoaded == null || domInteractive == null || loadEvent == null) {
			timing = null;
		} else {
			timing = new NavigationTiming(
				domContentLoaded.doubleValue(),
				domInteractive.doubleValue(),
				loadEvent.doubleValue(),
				transferSize == null ? 0 : transferSize.longValue());
		}
		Integer statusCode = (status == null || status.intValue() <= 0) ? null : status.intValue();
		return new NavigationResult(statusCode, timing);
	}

	private static @Nullable Number number(Map<?, ?> entry, String key) {
		Object value = entry.get(key);
		return (value instanceof Number) ? (Number) value : null;
	}

	/**
	 * Times are relative to the start of navigation.
	 * <code>responseStatus</code> is absent in browsers that don't report it.
	 */
	static final String NAVIGATION_TIMING_SCRIPT = String.join("\n",
		"var entries = performance.getEntriesByType('navigation');",
		"if (entries.length === 0) { return null; }",
		"var nav = entries[0];",
		"return {",
		"  responseStatus: nav.responseStatus,",
		"  domContentLoaded: nav.domContentLoadedEventEnd - nav.startTime,",
		"  domInteractive: nav.domInteractive - nav.startTime,",
		"  loadEvent: nav.loadEventEnd - nav.startTime,",
		"  transferSize: nav.transferSize || 0",
		"};");

	private static final Logger LOGGER = LoggerFactory.getLogger(SeleniumBrowserDriver.class);
}
