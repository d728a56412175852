package com.github.stormino.vimeocrawler.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a local directory, shortcut or link cannot be written.
 */
public class FilesystemException extends CrawlerException {

    private final Path path;

    public FilesystemException(String message, Throwable cause, Path path) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
