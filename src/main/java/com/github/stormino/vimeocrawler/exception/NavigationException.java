package com.github.stormino.vimeocrawler.exception;

/**
 * Exception thrown when a page or a page element could not be reached.
 */
public class NavigationException extends CrawlerException {

    private final String url;

    public NavigationException(String message, String url) {
        super(message);
        this.url = url;
    }

    public NavigationException(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
