package com.github.stormino.vimeocrawler.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything resolved for one attempt at downloading a video. Rebuilt on every attempt.
 */
@Data
@Builder
public class VideoDownloadPlan {

    private final long videoId;
    private final String title;

    /**
     * Chosen variant, null if the video offers none.
     */
    private final DownloadVariant variant;

    /**
     * Size announced by the server, null if unknown or not probed.
     */
    private final Long expectedByteSize;

    private final String localFileName;
    private final Path localPath;

    private final String userAgent;
    private final Map<String, String> cookies;

    public boolean hasVariant() {
        return variant != null;
    }
}
