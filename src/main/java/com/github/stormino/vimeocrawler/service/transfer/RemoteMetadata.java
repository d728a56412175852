package com.github.stormino.vimeocrawler.service.transfer;

import lombok.Builder;
import lombok.Data;

/**
 * What a metadata probe learned about a remote file.
 */
@Data
@Builder
public class RemoteMetadata {

    /**
     * Announced size in bytes, null if the server did not say.
     */
    private final Long contentLength;

    public boolean hasContentLength() {
        return contentLength != null && contentLength >= 0;
    }
}
