package com.github.stormino.vimeocrawler.service;

import com.github.stormino.vimeocrawler.config.CrawlerProperties;
import com.github.stormino.vimeocrawler.exception.NavigationException;
import com.github.stormino.vimeocrawler.model.CrawlSession;
import com.github.stormino.vimeocrawler.service.render.PageElement;
import com.github.stormino.vimeocrawler.service.render.PageRenderer;
import com.github.stormino.vimeocrawler.service.render.SiteSelectors;
import com.github.stormino.vimeocrawler.util.CrawlerConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Signs the browser session in, so private videos and the account's own
 * download links become visible.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final CrawlerProperties properties;

    /**
     * Log in and land on the account's own page.
     *
     * @return true on success; on failure the error is already counted
     */
    public boolean login(PageRenderer page, CrawlSession session) {
        CrawlerProperties.Login credentials = properties.getLogin();
        String loginUrl = properties.getSite().getBaseUrl() + "/" + CrawlerConstants.LOGIN_PATH;
        int attempts = Math.max(1, properties.getDownload().getRetryCount());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            log.info("Going to {}", loginUrl);
            try {
                page.navigate(loginUrl);
                log.info("Logging in as {}...", credentials.getEmail());
                if (submitCredentials(page, credentials)) {
                    return true;
                }
            } catch (NavigationException e) {
                log.error("Login failed: {}", e.getMessage());
            }
        }

        session.recordError();
        return false;
    }

    private boolean submitCredentials(PageRenderer page, CrawlerProperties.Login credentials) {
        Optional<PageElement> email = require(page, SiteSelectors.LOGIN_EMAIL);
        Optional<PageElement> password = email.flatMap(found -> require(page, SiteSelectors.LOGIN_PASSWORD));
        Optional<PageElement> submit = password.flatMap(found -> require(page, SiteSelectors.LOGIN_SUBMIT));
        if (submit.isEmpty()) {
            return false;
        }

        email.get().fill(credentials.getEmail());
        password.get().fill(credentials.getPassword());
        submit.get().click();

        Optional<PageElement> accountMenu = require(page, SiteSelectors.LOGIN_ACCOUNT_MENU);
        if (accountMenu.isEmpty()) {
            return false;
        }
        accountMenu.get().click();
        return true;
    }

    private Optional<PageElement> require(PageRenderer page, String selector) {
        Optional<PageElement> element = page.findElement(selector);
        if (element.isEmpty()) {
            log.error("Login failed: element {} not found", selector);
        }
        return element;
    }
}
