package com.github.stormino.vimeocrawler.model;

/**
 * Result of one processing attempt for a video.
 */
public enum DownloadOutcome {
    DOWNLOADED("Downloaded", true, true),
    ALREADY_PRESENT("Already downloaded", true, true),
    SKIPPED_INCONSISTENT("Skipped, local file larger than remote", true, false),
    SKIPPED_DISABLED("Skipped, downloads disabled", true, false),
    NO_VARIANT("No downloadable file", false, false),
    FAILED("Failed", false, false),
    INTERRUPTED("Interrupted", true, false);

    private final String displayName;
    private final boolean terminal;
    private final boolean successful;

    DownloadOutcome(String displayName, boolean terminal, boolean successful) {
        this.displayName = displayName;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether the attempt settles the video, ending the retry loop.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }
}
