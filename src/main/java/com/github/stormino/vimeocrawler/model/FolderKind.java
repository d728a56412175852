package com.github.stormino.vimeocrawler.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of named video groupings, keyed by the first path segment of their URL.
 */
public enum FolderKind {
    ALBUM("album", "album"),
    GROUP("groups", "group"),
    CHANNEL("channels", "channel");

    private final String segment;
    private final String displayName;

    FolderKind(String segment, String displayName) {
        this.segment = segment;
        this.displayName = displayName;
    }

    public String getSegment() {
        return segment;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Albums list their videos on the folder page itself, every other kind under "/videos".
     */
    public boolean paginatesUnderVideos() {
        return this != ALBUM;
    }

    public static Optional<FolderKind> fromSegment(String segment) {
        return Arrays.stream(values())
                .filter(kind -> kind.getSegment().equals(segment))
                .findFirst();
    }
}
