package com.github.stormino.vimeocrawler.model;

import lombok.Builder;
import lombok.Data;

import java.util.Locale;

/**
 * One quality option offered in a video's download panel.
 */
@Data
@Builder
public class DownloadVariant {

    /**
     * Link text, like "HD 1080p".
     */
    private final String label;

    /**
     * Extension of the suggested file name, without leading dot.
     */
    private final String fileExtension;

    private final String href;

    public String describe() {
        return label + "/" + fileExtension.toUpperCase(Locale.ROOT);
    }
}
