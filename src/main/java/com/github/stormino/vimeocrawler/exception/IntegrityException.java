package com.github.stormino.vimeocrawler.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a downloaded file does not match the size announced by the server.
 */
public class IntegrityException extends CrawlerException {

    private final Path file;
    private final Long expectedSize;
    private final Long actualSize;

    public IntegrityException(String message, Path file, Long expectedSize, Long actualSize) {
        super(message);
        this.file = file;
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
    }

    public Path getFile() {
        return file;
    }

    public Long getExpectedSize() {
        return expectedSize;
    }

    public Long getActualSize() {
        return actualSize;
    }
}
