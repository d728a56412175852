package com.github.stormino.vimeocrawler.exception;

/**
 * Exception thrown when the thread running a transfer is interrupted.
 */
public class TransferInterruptedException extends TransferException {

    public TransferInterruptedException(String url) {
        super("Download interrupted", url);
    }

    public TransferInterruptedException(Throwable cause, String url) {
        super("Download interrupted", cause, url);
    }
}
