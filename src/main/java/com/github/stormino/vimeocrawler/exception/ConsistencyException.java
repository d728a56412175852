package com.github.stormino.vimeocrawler.exception;

import java.util.List;

/**
 * Exception thrown when a listing page yields the same item more than once.
 * Signals a broken assumption about the site, never retried.
 */
public class ConsistencyException extends CrawlerException {

    private final String pageUrl;
    private final List<String> duplicates;

    public ConsistencyException(String message, String pageUrl, List<String> duplicates) {
        super(message);
        this.pageUrl = pageUrl;
        this.duplicates = duplicates;
    }

    public String getPageUrl() {
        return pageUrl;
    }

    public List<String> getDuplicates() {
        return duplicates;
    }
}
