package com.github.stormino.vimeocrawler.exception;

/**
 * Base exception for all crawl and download errors.
 */
public class CrawlerException extends RuntimeException {

    public CrawlerException(String message) {
        super(message);
    }

    public CrawlerException(String message, Throwable cause) {
        super(message, cause);
    }

    public CrawlerException(Throwable cause) {
        super(cause);
    }
}
