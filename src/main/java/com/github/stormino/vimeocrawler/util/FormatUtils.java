package com.github.stormino.vimeocrawler.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Utility class for formatting data sizes and progress values.
 */
@UtilityClass
public class FormatUtils {

    private static final String[] UNITS = {"bytes", "KB", "MB", "GB", "TB", "PB", "EB", "ZB", "YB"};

    /**
     * Format bytes to human-readable size string using binary units.
     * One decimal is kept only while it fits in three characters.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "512 bytes", "1.5 MB" or "234 GB"
     */
    public static String formatSize(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= CrawlerConstants.BYTES_PER_KIB && unit < UNITS.length - 1) {
            size /= CrawlerConstants.BYTES_PER_KIB;
            unit++;
        }
        String formatted = String.format(Locale.ROOT, "%.1f", size);
        if (formatted.length() > 3) {
            formatted = String.format(Locale.ROOT, "%.0f", size);
        }
        return formatted + " " + UNITS[unit];
    }

    /**
     * Format the position of an item within a run, like "3/40 7%".
     *
     * @param number One-based position
     * @param total Total number of items
     * @return Formatted position
     */
    public static String formatPosition(int number, int total) {
        int percent = total > 0 ? (int) (number * 100.0 / total) : 0;
        return String.format(Locale.ROOT, "%d/%d %d%%", number, total, percent);
    }
}
