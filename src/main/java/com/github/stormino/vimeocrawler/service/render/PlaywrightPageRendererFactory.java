package com.github.stormino.vimeocrawler.service.render;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightPageRendererFactory implements PageRendererFactory {

    private final CrawlerProperties properties;

    @Override
    public PageRenderer open() {
        CrawlerProperties.Browser config = properties.getBrowser();
        log.info("Starting {}...", config.getType());

        Playwright playwright = Playwright.create();
        try {
            Browser browser = browserType(playwright, config.getType())
                    .launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));
            BrowserContext browserContext = browser.newContext();
            Page page = browserContext.newPage();
            page.setDefaultNavigationTimeout(config.getNavigationTimeoutMs());
            page.setDefaultTimeout(config.getNavigationTimeoutMs());
            // A zero timeout means "wait forever" to Playwright
            double elementWaitMs = Math.max(1, config.getElementWaitMs());
            return new PlaywrightPageRenderer(playwright, browser, browserContext, page, elementWaitMs);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    private BrowserType browserType(Playwright playwright, String type) {
        switch (type) {
            case "chromium":
                return playwright.chromium();
            case "webkit":
                return playwright.webkit();
            default:
                return playwright.firefox();
        }
    }
}
