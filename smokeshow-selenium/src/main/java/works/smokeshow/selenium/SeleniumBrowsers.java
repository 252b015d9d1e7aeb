package works.smokeshow.selenium;

import io.github.bonigarcia.wdm.WebDriverManager;
import java.util.Locale;
import lombok.NonNull;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.edge.EdgeDriver;
import org.openqa.selenium.edge.EdgeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.smokeshow.config.SmokeshowConfig;

/**
 * Launches the local browser named by {@link SmokeshowConfig#browser()},
 * using WebDriverManager to fetch a matching driver binary.
 */
public final class SeleniumBrowsers {
	private SeleniumBrowsers() {}

	public static SeleniumBrowserDriver launch(@NonNull SmokeshowConfig config) {
		BrowserKind kind = BrowserKind.of(config.browser());
		LOGGER.info("Launching {} ({}, {}x{})",
			kind.name().toLowerCase(Locale.ROOT),
			config.headless() ? "headless" : "headed",
			config.viewportWidth(),
			config.viewportHeight());
		WebDriver webDriver = kind.start(config);
		try {
			webDriver.manage().window().setSize(new Dimension(config.viewportWidth(), config.viewportHeight()));
		} catch (RuntimeException e) {
			webDriver.quit();
			throw e;
		}
		return new SeleniumBrowserDriver(webDriver);
	}

	enum BrowserKind {
		CHROMIUM {
			@Override
			WebDriver start(SmokeshowConfig config) {
				WebDriverManager.chromedriver().setup();
				return new ChromeDriver(chromeOptions(config));
			}
		},
		FIREFOX {
			@Override
			WebDriver start(SmokeshowConfig config) {
				WebDriverManager.firefoxdriver().setup();
				return new FirefoxDriver(firefoxOptions(config));
			}
		},
		EDGE {
			@Override
			WebDriver start(SmokeshowConfig config) {
				WebDriverManager.edgedriver().setup();
				return new EdgeDriver(edgeOptions(config));
			}
		};

		abstract WebDriver start(SmokeshowConfig config);

		/**
		 * @throws IllegalArgumentException if <code>browser</code> isn't one we can launch
		 */
		static BrowserKind of(String browser) {
			switch (browser.trim().toLowerCase(Locale.ROOT)) {
				case "chromium":
				case "chrome":
					return CHROMIUM;
				case "firefox":
					return FIREFOX;
				case "edge":
				case "msedge":
					return EDGE;
				default:
					throw new IllegalArgumentException("Unsupported browser \"" + browser + "\"; expected chromium, firefox, or edge");
			}
		}
	}

	static ChromeOptions chromeOptions(SmokeshowConfig config) {
		ChromeOptions options = new ChromeOptions();
		if (config.headless()) {
			options.addArguments("--headless=new");
		}
		options.addArguments(windowSize(config));
		return options;
	}

	static FirefoxOptions firefoxOptions(SmokeshowConfig config) {
		FirefoxOptions options = new FirefoxOptions();
		if (config.headless()) {
			options.addArguments("-headless");
		}
		return options;
	}

	static EdgeOptions edgeOptions(SmokeshowConfig config) {
		EdgeOptions options = new EdgeOptions();
		if (config.headless()) {
			options.addArguments("--headless=new");
		}
		options.addArguments(windowSize(config));
		return options;
	}

	private static String windowSize(SmokeshowConfig config) {
		return "--window-size=" + config.viewportWidth() + "," + config.viewportHeight();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SeleniumBrowsers.class);
}
