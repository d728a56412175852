package com.github.stormino.vimeocrawler.exception;

/**
 * Exception thrown when a link does not point at the crawled site.
 */
public class InvalidLinkException extends CrawlerException {

    private final String link;

    public InvalidLinkException(String message, String link) {
        super(message);
        this.link = link;
    }

    public String getLink() {
        return link;
    }
}
