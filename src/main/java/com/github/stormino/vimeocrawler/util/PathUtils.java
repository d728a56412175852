package com.github.stormino.vimeocrawler.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for file path operations and filename sanitization.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    private static final String INVALID_FILENAME_CHARS = "[<>:\"/\\\\|?*']";

    /**
     * Sanitize filename by replacing invalid characters with underscores and trimming
     * trailing whitespace and dots.
     *
     * @param filename Original filename
     * @return Sanitized filename safe for filesystem use, empty for null or blank input
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        return stripTrailingDots(filename.replaceAll(INVALID_FILENAME_CHARS, "_"));
    }

    /**
     * Build the flat-store file name for a video.
     *
     * @param title Video title, may be empty
     * @param videoId Video ID, used when the title sanitizes to nothing
     * @param extension Extension without leading dot
     * @return File name like "My Clip.mp4" or "123456.mp4"
     */
    public static String buildVideoFileName(String title, long videoId, String extension) {
        String base = sanitizeFilename(title);
        if (base.isEmpty()) {
            base = String.valueOf(videoId);
        }
        return base + "." + extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Strip trailing whitespace and dots.
     */
    public static String stripTrailingDots(String value) {
        int end = value.length();
        while (end > 0 && (value.charAt(end - 1) == '.' || Character.isWhitespace(value.charAt(end - 1)))) {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create
     * @return true if directory exists or was created successfully, false otherwise
     */
    public static boolean createDirectoryStructure(Path path) {
        try {
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                log.debug("Created directory structure: {}", path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to create directory structure: {}", path, e);
            return false;
        }
    }

    /**
     * Get size of a file.
     *
     * @param file File to inspect
     * @return Size in bytes, or null if the file is absent or unreadable
     */
    public static Long fileSize(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return null;
        }
    }

    /**
     * Get extension from a suggested download name like "clip_hd.MP4".
     *
     * @param suggestedName Suggested file name
     * @return Extension without leading dot, or empty string if there is none
     */
    public static String getExtension(String suggestedName) {
        if (suggestedName == null || suggestedName.isBlank()) {
            return "";
        }

        int lastDot = suggestedName.lastIndexOf('.');
        if (lastDot >= 0 && lastDot < suggestedName.length() - 1) {
            return suggestedName.substring(lastDot + 1);
        }

        return "";
    }

    /**
     * Get a file name without its extension, the key duplicates are grouped by.
     * Dots inside the name are kept.
     *
     * @param filename File name
     * @return Stem, or null if the name has no dot
     */
    public static String getStem(String filename) {
        int lastDot = filename.lastIndexOf('.');
        return lastDot < 0 ? null : filename.substring(0, lastDot);
    }

    /**
     * Write a provenance shortcut pointing at the page a directory was mirrored from.
     *
     * @param directory Directory to write into
     * @param sourceUrl Page URL; a trailing "/videos" is not recorded
     * @return Path of the written shortcut
     */
    public static Path writeShortcutFile(Path directory, String sourceUrl) throws IOException {
        Path shortcut = directory.resolve(CrawlerConstants.SHORTCUT_FILE_NAME);
        Files.write(shortcut, List.of(CrawlerConstants.SHORTCUT_HEADER, "URL=" + stripVideosSuffix(sourceUrl)),
                StandardCharsets.UTF_8);
        log.debug("Wrote shortcut {} -> {}", shortcut, sourceUrl);
        return shortcut;
    }

    static String stripVideosSuffix(String url) {
        String suffix = "/" + CrawlerConstants.VIDEOS_SEGMENT;
        return url.toLowerCase(Locale.ROOT).endsWith(suffix) ? url.substring(0, url.length() - suffix.length()) : url;
    }
}
