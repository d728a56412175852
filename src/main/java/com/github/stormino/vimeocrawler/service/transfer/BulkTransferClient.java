package com.github.stormino.vimeocrawler.service.transfer;

import com.github.stormino.vimeocrawler.exception.TransferException;

import java.nio.file.Path;
import java.util.function.LongConsumer;

/**
 * Client for large file transfers made with the browser session's identity.
 */
public interface BulkTransferClient {

    /**
     * Ask the server about a file without downloading it.
     *
     * @throws TransferException if the server cannot be reached or refuses the request
     */
    RemoteMetadata fetchMetadata(TransferRequest request);

    /**
     * Stream a file to disk, replacing any existing file at the target.
     *
     * @param request What to fetch
     * @param target File to write
     * @param timeoutSeconds Longest time allowed without receiving any data
     * @param onProgress Receives the total number of bytes written so far
     * @return Number of bytes written
     * @throws TransferException on network fault, HTTP error, timeout or stall
     */
    long download(TransferRequest request, Path target, int timeoutSeconds, LongConsumer onProgress);
}
