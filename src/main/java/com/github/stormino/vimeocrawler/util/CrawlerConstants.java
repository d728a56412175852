package com.github.stormino.vimeocrawler.util;

import java.util.List;

/**
 * Constants used throughout the crawler.
 */
public final class CrawlerConstants {

    private CrawlerConstants() {
        // Utility class, no instantiation
    }

    // ========== Shortcut files ==========

    /**
     * Provenance file written into the target directory and every folder directory.
     */
    public static final String SHORTCUT_FILE_NAME = "source.url";

    /**
     * First line of a shortcut file.
     */
    public static final String SHORTCUT_HEADER = "[InternetShortcut]";

    // ========== URL grammar ==========

    /**
     * Sub-path under which accounts and most folders paginate their videos.
     */
    public static final String VIDEOS_SEGMENT = "videos";

    /**
     * Listing links ending with this suffix lead to edit pages, not content.
     */
    public static final String SETTINGS_SUFFIX = "settings";

    /**
     * Login page path, relative to the site base URL.
     */
    public static final String LOGIN_PATH = "log_in";

    // ========== Downloads ==========

    /**
     * Download link labels from best to worst quality; the last one matches any file link.
     */
    public static final List<String> FILE_PREFERENCES = List.of("Original", "HD", "SD", "Mobile", "file");

    /**
     * Label and extension used when a video offers no downloadable variant.
     */
    public static final String NO_VARIANT = "NONE";

    /**
     * Extension assumed when a download link does not suggest a file name.
     */
    public static final String DEFAULT_EXTENSION = "mp4";

    // ========== Size Units ==========

    /**
     * Bytes in one kibibyte (1024 bytes).
     */
    public static final long BYTES_PER_KIB = 1024L;

    /**
     * Bytes in one mebibyte.
     */
    public static final long BYTES_PER_MIB = 1024L * 1024;

    /**
     * Default amount of data between two progress log lines.
     */
    public static final long DEFAULT_PROGRESS_QUANTUM_BYTES = 10 * BYTES_PER_MIB;

    // ========== Transfer ==========

    /**
     * Read buffer for streaming a download to disk.
     */
    public static final int TRANSFER_BUFFER_SIZE = 64 * 1024;
}
