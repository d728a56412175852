package com.github.stormino.vimeocrawler.service.render;

import com.github.stormino.vimeocrawler.exception.NavigationException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A browser session the crawler drives page by page. Lookups wait for elements
 * according to the implementation's own policy and report absence as an empty
 * result rather than an exception.
 */
public interface PageRenderer extends AutoCloseable {

    /**
     * Load a page.
     *
     * @throws NavigationException if the page cannot be loaded
     */
    void navigate(String url);

    Optional<PageElement> findElement(String selector);

    List<PageElement> findElements(String selector);

    String currentUrl();

    /**
     * Evaluate a JavaScript expression in the current page.
     */
    Object executeScript(String script);

    /**
     * Cookies of the session, name to value.
     *
     * @throws com.github.stormino.vimeocrawler.exception.NavigationException if the browser cannot report them
     */
    Map<String, String> getCookies();

    /**
     * Release the browser. Safe to call more than once.
     */
    @Override
    void close();
}
