package com.github.stormino.vimeocrawler.exception;

/**
 * Exception thrown when a bulk transfer fails: network fault, HTTP error, timeout or stall.
 */
public class TransferException extends CrawlerException {

    private final String url;

    public TransferException(String message, String url) {
        super(message);
        this.url = url;
    }

    public TransferException(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
