package com.github.stormino.vimeocrawler.service.render;

import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitForSelectorState;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link PageRenderer} driving a single Playwright page.
 *
 * <p>Owns the whole Playwright stack it was opened with and releases it in reverse
 * order on close. Close is idempotent.
 */
@Slf4j
public class PlaywrightPageRenderer implements PageRenderer {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final Page page;
    private final double elementWaitMs;
    private boolean closed = false;

    PlaywrightPageRenderer(Playwright playwright, Browser browser, BrowserContext browserContext, Page page,
                           double elementWaitMs) {
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.page = page;
        this.elementWaitMs = elementWaitMs;
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(url);
        } catch (PlaywrightException e) {
            throw new NavigationException("Failed to load page: " + e.getMessage(), e, url);
        }
    }

    @Override
    public Optional<PageElement> findElement(String selector) {
        Locator first = page.locator(selector).first();
        if (!waitForAttached(first)) {
            log.debug("Element not found: {}", selector);
            return Optional.empty();
        }
        return Optional.of(new PlaywrightPageElement(first));
    }

    @Override
    public List<PageElement> findElements(String selector) {
        Locator locator = page.locator(selector);
        if (!waitForAttached(locator.first())) {
            return Collections.emptyList();
        }
        try {
            return locator.all().stream()
                    .map(PlaywrightPageElement::new)
                    .collect(Collectors.toList());
        } catch (PlaywrightException e) {
            throw new NavigationException("Failed to list " + selector + ": " + e.getMessage(), e, page.url());
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public Object executeScript(String script) {
        try {
            return page.evaluate(script);
        } catch (PlaywrightException e) {
            throw new NavigationException("Script failed: " + e.getMessage(), e, page.url());
        }
    }

    @Override
    public Map<String, String> getCookies() {
        Map<String, String> cookies = new LinkedHashMap<>();
        try {
            for (Cookie cookie : browserContext.cookies()) {
                cookies.put(cookie.name, cookie.value);
            }
        } catch (PlaywrightException e) {
            throw new NavigationException("Failed to read cookies: " + e.getMessage(), e, page.url());
        }
        return cookies;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try {
            browserContext.close();
        } catch (Exception e) {
            log.warn("Failed to close browser context: {}", e.getMessage());
        }

        try {
            browser.close();
        } catch (Exception e) {
            log.warn("Failed to close browser: {}", e.getMessage());
        }

        try {
            playwright.close();
        } catch (Exception e) {
            log.warn("Failed to close playwright: {}", e.getMessage());
        }
        log.debug("Browser session closed");
    }

    private boolean waitForAttached(Locator locator) {
        try {
            locator.waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(elementWaitMs));
            return true;
        } catch (TimeoutError e) {
            return false;
        }
    }
}
